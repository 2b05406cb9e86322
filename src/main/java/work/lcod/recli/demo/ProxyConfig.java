package work.lcod.recli.demo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.recli.api.FieldTag;

/**
 * Sample record edited by {@code recli-demo}: a reverse proxy with its backends.
 */
public final class ProxyConfig {
    @FieldTag(name = "usage", value = "Address the proxy listens on")
    @FieldTag(name = "default", value = ":8080")
    private String address;

    @FieldTag(name = "usage", value = "How clients authenticate (static or ldap)")
    @FieldTag(name = "default", value = "static")
    private AuthMode authMode;

    @FieldTag(name = "default", value = "30000")
    private long timeoutMS;

    @FieldTag(name = "usage", value = "Upstream servers")
    private List<Backend> backends = new ArrayList<>();

    @FieldTag(name = "usage", value = "Headers added to every proxied request")
    private Map<String, String> headers = new LinkedHashMap<>();

    @FieldTag(name = "default", value = "*")
    private List<String> allowedOrigins = new ArrayList<>();

    private TlsSettings tls = new TlsSettings();

    @FieldTag(name = "recli", value = "-")
    private String adminToken;

    public String address() {
        return address;
    }

    public AuthMode authMode() {
        return authMode;
    }

    public long timeoutMS() {
        return timeoutMS;
    }

    public List<Backend> backends() {
        return backends;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public List<String> allowedOrigins() {
        return allowedOrigins;
    }

    public TlsSettings tls() {
        return tls;
    }

    public String adminToken() {
        return adminToken;
    }
}
