package work.lcod.recli.demo;

import java.util.ArrayList;
import java.util.List;
import work.lcod.recli.api.FieldTag;

/**
 * Upstream server, keyed on the command line by its host name.
 */
public final class Backend {
    @FieldTag(name = "recli", value = "id")
    @FieldTag(name = "usage", value = "Host name of the upstream server")
    private String hostname;

    @FieldTag(name = "default", value = "2019")
    private int port;

    @FieldTag(name = "usage", value = "Connect to the backend over TLS")
    private boolean secure;

    @FieldTag(name = "default", value = "1.0")
    private double weight;

    private List<String> tags = new ArrayList<>();

    public Backend() {}

    public Backend(String hostname, int port) {
        this.hostname = hostname;
        this.port = port;
    }

    public String hostname() {
        return hostname;
    }

    public int port() {
        return port;
    }

    public boolean secure() {
        return secure;
    }

    public double weight() {
        return weight;
    }

    public List<String> tags() {
        return tags;
    }
}
