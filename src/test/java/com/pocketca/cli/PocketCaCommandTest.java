package com.pocketca.cli;

import com.pocketca.crl.RevocationLedger;
import com.pocketca.crypto.PemCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for PocketCaCommand
 */
class PocketCaCommandTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Map<String, String> env;
    private final PemCodec pemCodec = new PemCodec();

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        env = new HashMap<>();
        env.put("POCKETCA_MIN_RSA_KEY_SIZE", "1024");
        env.put("POCKETCA_RSA_KEY_SIZE", "1024");
    }

    private int run(String... args) {
        out.reset();
        err.reset();
        List<String> all = new ArrayList<>(Arrays.asList("-d", tempDir.toString()));
        all.addAll(Arrays.asList(args));
        PocketCaCommand command = new PocketCaCommand(
            new PrintStream(out, true), new PrintStream(err, true), env);
        return command.run(all.toArray(new String[0]));
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    private X509Certificate certificate(String name) throws IOException {
        return pemCodec.decodeCertificate(Files.readAllBytes(tempDir.resolve(name + ".crt")));
    }

    @Nested
    @DisplayName("usage")
    class Usage {

        @Test
        @DisplayName("should print usage and exit 1 without a command")
        void shouldPrintUsageWithoutCommand() {
            assertEquals(PocketCaCommand.EXIT_USAGE, run());
            assertTrue(stdout().contains("pocketca revoke NAME [ca=xx]"));
        }

        @Test
        @DisplayName("should print help and exit 0")
        void shouldPrintHelp() {
            assertEquals(PocketCaCommand.EXIT_OK, run("--help"));
            assertTrue(stdout().contains("--dir"));
        }

        @Test
        @DisplayName("should exit 2 on an unknown command")
        void shouldRejectUnknownCommand() {
            assertEquals(PocketCaCommand.EXIT_FAILURE, run("wwww"));
            assertTrue(stderr().contains("Unknown profile"));
        }

        @Test
        @DisplayName("should exit 1 on an unsupported field")
        void shouldRejectUnsupportedField() {
            assertEquals(PocketCaCommand.EXIT_USAGE, run("root", "OU=x"));
            assertTrue(stderr().contains("Unsupported field: [OU]"));
            assertFalse(Files.exists(tempDir.resolve("root.crt")));
        }
    }

    @Nested
    @DisplayName("issuance")
    class Issuance {

        @Test
        @DisplayName("should create a root CA and report progress")
        void shouldCreateRoot() throws IOException {
            assertEquals(PocketCaCommand.EXIT_OK, run("root"));

            String output = stdout();
            assertTrue(output.contains("Generating RSA-1024 key"));
            assertTrue(output.contains("Saving results to root.[crt|key]"));
            assertTrue(output.trim().endsWith("done"));
            assertTrue(Files.exists(tempDir.resolve("root.crt")));
            assertTrue(Files.exists(tempDir.resolve("root.key")));
            assertEquals("OU=Root,CN=root,O=Home",
                certificate("root").getSubjectX500Principal().getName());
        }

        @Test
        @DisplayName("should refuse an existing name with exit 2 before generating a key")
        void shouldRefuseExisting() throws IOException {
            run("root");
            byte[] before = Files.readAllBytes(tempDir.resolve("root.key"));

            assertEquals(PocketCaCommand.EXIT_FAILURE, run("root"));

            assertTrue(stderr().contains("already exists"));
            assertFalse(stdout().contains("Generating"));
            assertArrayEquals(before, Files.readAllBytes(tempDir.resolve("root.key")));
        }

        @Test
        @DisplayName("should issue a web server certificate that chains to root")
        void shouldIssueWebServer() throws Exception {
            run("root", "O=Acme", "C=FR");

            assertEquals(PocketCaCommand.EXIT_OK,
                run("www", "CN=www1", "dns=www1.example.com", "dns=example.com"));

            assertTrue(stdout().contains("SAN[DNS:www1.example.com,DNS:example.com]"));
            X509Certificate root = certificate("root");
            X509Certificate www = certificate("www1");
            www.verify(root.getPublicKey());
            assertEquals(root.getSubjectX500Principal(), www.getIssuerX500Principal());
            assertEquals("OU=Server,CN=www1,O=Acme,C=FR", www.getSubjectX500Principal().getName());
            assertEquals(2, www.getSubjectAlternativeNames().size());
        }

        @Test
        @DisplayName("should sign with a sub CA selected by ca=")
        void shouldSignWithSubCa() throws Exception {
            run("root");
            assertEquals(PocketCaCommand.EXIT_OK, run("sub", "CN=sub1"));
            assertEquals(PocketCaCommand.EXIT_OK, run("client", "CN=bob", "ca=sub1", "ec=prime256v1"));

            assertTrue(stdout().contains("Generating EC key [prime256v1]"));
            certificate("bob").verify(certificate("sub1").getPublicKey());
            certificate("sub1").verify(certificate("root").getPublicKey());
        }

        @Test
        @DisplayName("should exit 2 when the signing authority is missing")
        void shouldFailWithoutAuthority() {
            assertEquals(PocketCaCommand.EXIT_FAILURE, run("server"));

            assertTrue(stderr().contains("root.crt"));
            assertFalse(Files.exists(tempDir.resolve("server.key")));
        }

        @Test
        @DisplayName("should exit 2 for an EC key on a server")
        void shouldRejectEcServer() {
            run("root");

            assertEquals(PocketCaCommand.EXIT_FAILURE, run("server", "ec=prime256v1"));
            assertTrue(stderr().contains("EC keys are only supported for clients"));
        }
    }

    @Nested
    @DisplayName("revocation")
    class Revocation {

        @Test
        @DisplayName("should report a missing CRL")
        void shouldReportMissingCrl() {
            run("root");

            assertEquals(PocketCaCommand.EXIT_OK, run("crl"));
            assertEquals("No CRL found", stdout().trim());
        }

        @Test
        @DisplayName("should revoke by name and list the serial")
        void shouldRevokeAndList() throws Exception {
            run("root");
            run("www", "CN=www1", "dns=www1.example.com");
            BigInteger serial = certificate("www1").getSerialNumber();

            assertEquals(PocketCaCommand.EXIT_OK, run("revoke", "www1"));

            X509CRL crl = pemCodec.decodeCrl(Files.readAllBytes(tempDir.resolve("root.crl")));
            crl.verify(certificate("root").getPublicKey());
            assertNotNull(crl.getRevokedCertificate(serial));
            assertEquals(BigInteger.ONE, RevocationLedger.crlNumber(crl));

            assertEquals(PocketCaCommand.EXIT_OK, run("crl", "ca=root"));
            String listing = stdout();
            assertTrue(listing.startsWith("-- Revoked certificates found in CRL"));
            assertTrue(listing.contains("serial: " + serial.toString(16).toUpperCase(Locale.ROOT)));
            assertTrue(listing.contains("  date: "));
            assertTrue(listing.contains(" GMT"));
        }

        @Test
        @DisplayName("should exit 1 when revoke has no name")
        void shouldRequireName() {
            assertEquals(PocketCaCommand.EXIT_USAGE, run("revoke"));
        }

        @Test
        @DisplayName("should exit 1 when revoke names a path")
        void shouldRefusePathNames() {
            run("root");

            assertEquals(PocketCaCommand.EXIT_USAGE, run("revoke", "../x", "ca=root"));
            assertEquals(PocketCaCommand.EXIT_USAGE, run("revoke", "root", "ca=../y"));
        }

        @Test
        @DisplayName("should exit 2 when the name does not exist")
        void shouldFailOnUnknownName() {
            run("root");

            assertEquals(PocketCaCommand.EXIT_FAILURE, run("revoke", "ghost"));
            assertTrue(stderr().contains("Cannot find: ghost.crt"));
        }
    }

    @Nested
    @DisplayName("dh and configuration")
    class Extras {

        @Test
        @DisplayName("should write DH parameters once")
        void shouldWriteDhParameters() throws IOException {
            assertEquals(PocketCaCommand.EXIT_OK, run("dh", "512"));

            String pem = new String(Files.readAllBytes(tempDir.resolve("dh512.pem")), StandardCharsets.US_ASCII);
            assertTrue(pem.startsWith("-----BEGIN DH PARAMETERS-----"));

            assertEquals(PocketCaCommand.EXIT_FAILURE, run("dh", "512"));
            assertEquals(PocketCaCommand.EXIT_USAGE, run("dh", "many"));
        }

        @Test
        @DisplayName("should write a configuration template")
        void shouldWriteTemplate() {
            Path file = tempDir.resolve("pocketca.json");

            assertEquals(PocketCaCommand.EXIT_OK, run("--write-config", file.toString()));
            assertTrue(Files.exists(file));
        }

        @Test
        @DisplayName("should take the store directory from a configuration file")
        void shouldReadConfigFile() throws IOException {
            Path file = tempDir.resolve("conf.json");
            Files.write(file, "{\"storeDirectory\": \"pki\", \"defaultOrganization\": \"Lab\"}"
                .getBytes(StandardCharsets.UTF_8));

            PocketCaCommand command = new PocketCaCommand(new PrintStream(out, true), new PrintStream(err, true), env);
            assertEquals(PocketCaCommand.EXIT_OK, command.run(new String[] {"-c", file.toString(), "root"}));

            assertTrue(Files.exists(tempDir.resolve("pki/root.crt")));
            assertTrue(pemCodec.decodeCertificate(Files.readAllBytes(tempDir.resolve("pki/root.crt")))
                .getSubjectX500Principal().getName().contains("O=Lab"));
        }
    }
}
