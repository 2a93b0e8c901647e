package no.cantara.standards;

import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertNotNull;

final class Fixtures {

    private Fixtures() {}

    static Path corpus(String name) {
        URL url = Fixtures.class.getClassLoader().getResource("fixtures/" + name);
        assertNotNull(url, "fixture not found: " + name);
        return Paths.get(url.getPath());
    }

    static Path regional() {
        return corpus("regional");
    }
}
