package work.lcod.recli.demo;

/**
 * How the proxy authenticates clients. Printed and parsed through its lower-case name.
 */
public enum AuthMode {
    STATIC("static"),
    LDAP("ldap");

    private final String text;

    AuthMode(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return text;
    }
}
