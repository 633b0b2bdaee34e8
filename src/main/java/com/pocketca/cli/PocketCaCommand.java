package com.pocketca.cli;

import com.pocketca.PocketCa;
import com.pocketca.config.CaConfig;
import com.pocketca.config.ConfigLoader;
import com.pocketca.crl.RevokedEntry;
import com.pocketca.crypto.KeyGenerationListener;
import com.pocketca.crypto.KeySpec;
import com.pocketca.exception.PkiException;
import com.pocketca.exception.ValidationException;
import com.pocketca.model.IssuanceRequest;
import com.pocketca.model.SubjectAltName;
import com.pocketca.profile.IdentityProfile;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Command line front end.
 *
 * <pre>
 * pocketca [-d dir] [-c config.json] root   [DN] [days=xx]
 * pocketca [-d dir] [-c config.json] www    [DN] [days=xx] [ca=xx] [dns=x] [dns=y]
 * pocketca [-d dir] [-c config.json] crl    [ca=xx]
 * pocketca [-d dir] [-c config.json] revoke NAME [ca=xx]
 * pocketca [-d dir] [-c config.json] dh     [numbits]
 * </pre>
 */
public class PocketCaCommand {

    private static final Logger logger = LoggerFactory.getLogger(PocketCaCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FAILURE = 2;

    private static final String OPT_DIR = "d";
    private static final String OPT_CONFIG = "c";
    private static final String OPT_WRITE_CONFIG = "write-config";
    private static final String OPT_HELP = "h";

    private static final DateTimeFormatter CRL_DATE_FORMAT =
        DateTimeFormatter.ofPattern("MMM ppd HH:mm:ss yyyy 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    private static final String USAGE_DETAILS = String.join("\n",
        "",
        "    pocketca root   [DN] [days=xx]         # Create a root CA",
        "    pocketca sub    [DN] [days=xx] [ca=xx] # Create a sub CA",
        "    pocketca server [DN] [days=xx] [ca=xx] # Create a server",
        "    pocketca client [DN] [days=xx] [ca=xx] # Create a client",
        "    pocketca www    [DN] [days=xx] [ca=xx] [dns=x] [dns=x]",
        "",
        "Where DN is given as key=val pairs. Supported fields:",
        "",
        "    O     Organization, only for root (default: Home)",
        "    CN    Common Name (default: the command name)",
        "    C     2-letter country code like US, FR, UK (optional)",
        "    ST    a state name (optional)",
        "    L     a locality or city name (optional)",
        "    email an email address",
        "",
        "    days specifies certificate duration in days",
        "",
        "Key generation:",
        "    Either RSA with keysize set by rsa=xx",
        "    Or elliptic-curve with curve name set by ec=xx (clients only)",
        "    Default is RSA-2048, i.e. rsa=2048",
        "    Signing CA is specified with ca=CN (default: root)",
        "",
        "CRL management",
        "    pocketca crl [ca=xx]            # Show CRL for CA xx",
        "    pocketca revoke NAME [ca=xx]    # Revoke single cert by name",
        "",
        "    pocketca dh [numbits]           # Generate DH parameters",
        "");

    private final PrintStream out;
    private final PrintStream err;
    private final Map<String, String> environment;

    public PocketCaCommand(PrintStream out, PrintStream err, Map<String, String> environment) {
        this.out = out;
        this.err = err;
        this.environment = environment;
    }

    public static void main(String[] args) {
        System.exit(new PocketCaCommand(System.out, System.err, System.getenv()).run(args));
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder(OPT_DIR).longOpt("dir").hasArg().argName("dir")
            .desc("directory holding the certificates, keys and CRLs").build());
        options.addOption(Option.builder(OPT_CONFIG).longOpt("config").hasArg().argName("file")
            .desc("JSON configuration file").build());
        options.addOption(Option.builder().longOpt(OPT_WRITE_CONFIG).hasArg().argName("file")
            .desc("write a configuration template holding every default and exit").build());
        options.addOption(Option.builder(OPT_HELP).longOpt("help").desc("print this help").build());
        return options;
    }

    /**
     * Run one command.
     *
     * @return process exit status
     */
    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printUsage(options);
            return EXIT_USAGE;
        }

        if (cmd.hasOption(OPT_HELP)) {
            printUsage(options);
            return EXIT_OK;
        }

        ConfigLoader loader = new ConfigLoader(environment);
        if (cmd.hasOption(OPT_WRITE_CONFIG)) {
            return execute(() -> {
                loader.createTemplate(cmd.getOptionValue(OPT_WRITE_CONFIG));
                out.println("Wrote configuration template to " + cmd.getOptionValue(OPT_WRITE_CONFIG));
            });
        }

        List<String> remaining = cmd.getArgList();
        if (remaining.isEmpty()) {
            printUsage(options);
            return EXIT_USAGE;
        }
        String verb = remaining.get(0);
        List<String> verbArgs = remaining.subList(1, remaining.size());

        return execute(() -> {
            Map<String, Object> overrides = new HashMap<>();
            if (cmd.hasOption(OPT_DIR)) {
                overrides.put("storeDirectory", cmd.getOptionValue(OPT_DIR));
            }
            CaConfig config = loader.load(cmd.getOptionValue(OPT_CONFIG), true, overrides);
            dispatch(new PocketCa(config), new RequestParser(config), verb, verbArgs);
        });
    }

    private int execute(Runnable action) {
        try {
            action.run();
            return EXIT_OK;
        } catch (ValidationException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (PkiException e) {
            logger.debug("Command failed with {}", e.getCode(), e);
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void dispatch(PocketCa ca, RequestParser parser, String verb, List<String> args) {
        switch (verb) {
            case "crl":
                showCrl(ca, parser.parseAuthority(args));
                break;
            case "revoke":
                if (args.isEmpty()) {
                    throw new ValidationException("revoke needs the name of the identity to revoke", "NAME");
                }
                revoke(ca, args.get(0), parser.parseAuthority(args.subList(1, args.size())));
                break;
            case "dh":
                generateDh(ca, args);
                break;
            default:
                issue(ca, parser, IdentityProfile.fromCommand(verb), args);
                break;
        }
    }

    private void issue(PocketCa ca, RequestParser parser, IdentityProfile profile, List<String> args) {
        IssuanceRequest request = parser.parseIssuance(profile, args);
        if (!request.getSubjectAltNames().isEmpty()) {
            out.println("SAN[" + request.getSubjectAltNames().stream()
                .map(SubjectAltName::render)
                .collect(Collectors.joining(",")) + "]");
        }
        ca.buildIdentity(request, new KeyGenerationListener() {
            @Override
            public void onStarted(KeySpec spec) {
                out.println("Generating " + spec);
            }
        });
        out.println("Saving results to " + request.getCommonName() + ".[crt|key]");
        out.println("done");
    }

    private void showCrl(PocketCa ca, String authority) {
        if (!Files.exists(ca.getStore().crlPath(authority))) {
            out.println("No CRL found");
            return;
        }
        List<RevokedEntry> entries = ca.listRevoked(authority);
        out.println("-- Revoked certificates found in CRL");
        for (RevokedEntry entry : entries) {
            out.println("serial: " + entry.getSerialNumber().toString(16).toUpperCase(Locale.ROOT));
            out.println("  date: " + CRL_DATE_FORMAT.format(entry.getRevocationDate()));
            out.println();
        }
    }

    private void revoke(PocketCa ca, String name, String authority) {
        ca.revoke(authority, name);
        out.println("Revoked " + name + " in " + authority + ".crl");
    }

    private void generateDh(PocketCa ca, List<String> args) {
        int bits = ca.getConfig().getDefaultDhBits();
        if (args.size() > 1) {
            throw new ValidationException("dh takes at most one argument", "bits");
        }
        if (!args.isEmpty()) {
            try {
                bits = Integer.parseInt(args.get(0));
            } catch (NumberFormatException e) {
                throw new ValidationException("bits must be an integer, got: " + args.get(0), "bits");
            }
        }
        out.println("Generating DH parameters (" + bits + " bits), this can take long");
        Path path = ca.generateDhParameters(bits);
        out.println("Wrote " + path.getFileName());
        out.println("done");
    }

    private void printUsage(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH,
            "pocketca [options] <command> [key=value ...]", null, options,
            HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, USAGE_DETAILS);
        writer.flush();
    }
}
