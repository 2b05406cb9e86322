package work.lcod.recli.demo;

import work.lcod.recli.api.FieldTag;

public final class TlsSettings {
    private boolean enabled;

    @FieldTag(name = "default", value = "/etc/proxy/cert.pem")
    private String certFile;

    @FieldTag(name = "default", value = "TLSv1.3")
    private String minVersion;

    public boolean enabled() {
        return enabled;
    }

    public String certFile() {
        return certFile;
    }

    public String minVersion() {
        return minVersion;
    }
}
