package org.cobbzilla.s3fetch;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.Protocol;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import lombok.Cleanup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.kohsuke.args4j.CmdLineParser;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static com.amazonaws.SDKGlobalConfiguration.DISABLE_CERT_CHECKING_SYSTEM_PROPERTY;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the "main" method. Responsible for parsing options and setting up the FetchMaster to run the fetch.
 */
@Slf4j
public class FetchMain {

    private final String[] args;

    @Getter private final FetchOptions options = new FetchOptions();

    private final CmdLineParser parser = new CmdLineParser(options);

    private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler = new Thread.UncaughtExceptionHandler() {
        @Override public void uncaughtException(Thread t, Throwable e) {
            log.error("Uncaught Exception (thread "+t.getName()+"): "+e, e);
        }
    };

    @Getter private AmazonS3 client;
    @Getter private FetchContext context;
    private FetchMaster master;

    public FetchMain(String[] args) { this.args = args; }

    public static void main (String[] args) {
        FetchMain main = new FetchMain(args);
        main.init();
        main.run();
    }

    public FetchReport run() {
        return master.fetch();
    }

    public void init() {
        try {
            parseArguments();
        } catch (Exception e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            System.exit(1);
        }

        try {
            Files.createDirectories(options.getLocalRoot());
        } catch (IOException e) {
            log.error("Cannot create local directory {}.", options.getLocalRoot(), e);
            System.exit(1);
        }

        if (options.isDisableCertCheck())
            System.setProperty(DISABLE_CERT_CHECKING_SYSTEM_PROPERTY, "true");

        try {
            init(getAmazonS3Client(options.getProfile()));
        } catch (RuntimeException e) {
            log.error("Cannot create S3 client for profile {}.", options.getProfileName(), e);
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(context.getStats().getShutdownHook());
        Thread.setDefaultUncaughtExceptionHandler(uncaughtExceptionHandler);
    }

    void init(AmazonS3 client) {
        this.client = client;
        context = new FetchContext(options, client);
        master = new FetchMaster(context);
    }

    protected AmazonS3 getAmazonS3Client(FetchProfile profile) {
        if (!profile.isValid()) {
            throw new IllegalStateException("Profile is invalid");
        }

        ClientConfiguration clientConfiguration = new ClientConfiguration()
                .withProtocol(profile.getEndpoint().startsWith("https:") ? Protocol.HTTPS : Protocol.HTTP)
                .withMaxConnections(options.getMaxConnections());

        if (profile.getSignerType() != null) {
            clientConfiguration.setSignerOverride(profile.getSignerType());
        }

        if (profile.hasProxy()) {
            clientConfiguration.setProxyHost(profile.getProxyHost());
            clientConfiguration.setProxyPort(profile.getProxyPort());
        }

        return AmazonS3ClientBuilder
                .standard()
                .withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(profile.getEndpoint(), profile.getRegion()))
                .withPathStyleAccessEnabled(profile.hasOption(FetchProfileOptions.PATH_STYLE_ACCESS))
                .withClientConfiguration(clientConfiguration)
                .withCredentials(new AWSStaticCredentialsProvider(profile))
                .build();
    }

    protected void parseArguments() throws Exception {
        parser.parseArgument(args);

        if (options.getProfileName() == null || options.getProfileName().equals("")) {
            throw new IllegalStateException("No profile specified");
        }

        FetchProfile profile = options.getProfile();
        profile.setName(options.getProfileName());

        loadAwsKeysFromS3Config(profile);

        if (!profile.isValid()) {
            throw new IllegalStateException("Could not find credentials for profile " + profile.getName());
        }

        options.initDerivedFields();
    }

    private static String readFile(String path) throws IOException {
        byte[] encoded = Files.readAllBytes(Paths.get(path));
        return new String(encoded, UTF_8).trim();
    }

    Path getS3ConfigPath() {
        if (options.getS3cfg() != null) return Paths.get(options.getS3cfg());

        String s3CfgPath = System.getenv("S3CFG");
        if (s3CfgPath == null) {
            s3CfgPath = "./.s3cfg";
            if (!new File(s3CfgPath).isFile())
                s3CfgPath = System.getProperty("user.home") + File.separator + ".s3cfg";
        }
        return Paths.get(s3CfgPath);
    }

    private void loadAwsKeysFromS3Config(FetchProfile profile) throws Exception {
        @Cleanup BufferedReader reader = Files.newBufferedReader(getS3ConfigPath(), UTF_8);
        String line;
        boolean skipSection = true;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("[")) {
                skipSection = !line.equals("[" + profile.getName() + "]");
                continue;
            }
            if (skipSection) continue;

            if (line.matches("^access_key\\s*=.*")) {
                profile.setAWSAccessKeyId(valueOf(line));
            } else if (line.matches("^access_key_path\\s*=.*")) {
                profile.setAWSAccessKeyId(readFile(valueOf(line)));
            } else if (line.matches("^access_token\\s*=.*")) {
                profile.setAWSSecretKey(valueOf(line));
            } else if (line.matches("^access_token_path\\s*=.*")) {
                profile.setAWSSecretKey(readFile(valueOf(line)));
            } else if (line.matches("^proxy_host\\s*=.*")) {
                profile.setProxyHost(valueOf(line));
            } else if (line.matches("^proxy_port\\s*=.*")) {
                profile.setProxyPort(Integer.parseInt(valueOf(line)));
            } else if (line.matches("^website_endpoint\\s*=.*")) {
                profile.setEndpoint(valueOf(line));
            } else if (line.matches("^signer_type\\s*=.*")) {
                profile.setSignerType(valueOf(line));
            } else if (line.matches("^region\\s*=.*")) {
                profile.setRegion(valueOf(line));
            } else if (line.matches("^options\\s*=.*")) {
                for (String option : valueOf(line).split("\\s*,\\s*")) {
                    profile.addOption(FetchProfileOptions.valueOf(option));
                }
            } else if (line.matches("^\\s*#.*")) {
                continue;
            } else {
                throw new IllegalStateException("unknown line: " + line);
            }
        }
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf("=") + 1).trim();
    }
}
