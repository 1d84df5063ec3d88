package io.github.augsuggest.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

/// Base class for all command line tests.
/// - Emits an INFO banner per test.
public class CliTestBase extends CliLoggingConfig {

    static final Logger LOG = Logger.getLogger("io.github.augsuggest.cli");

    static final String HOSTS_DUMP = """
            /files/etc/hosts/1
            /files/etc/hosts/1/ipaddr = "127.0.0.1"
            /files/etc/hosts/1/canonical = "localhost"
            /files/etc/hosts/2
            /files/etc/hosts/2/ipaddr = "127.0.0.1"
            /files/etc/hosts/2/canonical = "other"
            """;

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }
}
