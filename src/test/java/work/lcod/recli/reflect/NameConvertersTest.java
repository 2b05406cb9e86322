package work.lcod.recli.reflect;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class NameConvertersTest {
    @Test
    void keepsSingleLowercaseWord() {
        assertEquals("address", NameConverters.toLowerDashCase("address"));
    }

    @Test
    void splitsCamelCaseWords() {
        assertEquals("listen-address", NameConverters.toLowerDashCase("listenAddress"));
        assertEquals("allowed-origins", NameConverters.toLowerDashCase("allowedOrigins"));
    }

    @Test
    void keepsUppercaseRunTogether() {
        assertEquals("timeout-ms", NameConverters.toLowerDashCase("timeoutMS"));
        assertEquals("url", NameConverters.toLowerDashCase("URL"));
    }

    @Test
    void trailingCapitalDoesNotStartWord() {
        assertEquals("sizeb", NameConverters.toLowerDashCase("sizeB"));
    }

    @Test
    void lowercasesLeadingCapital() {
        assertEquals("name", NameConverters.toLowerDashCase("Name"));
    }
}
