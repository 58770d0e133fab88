package org.cobbzilla.s3fetch;

import lombok.Getter;
import lombok.Setter;
import org.joda.time.DateTime;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;

import java.io.File;
import java.nio.file.Path;
import java.util.Date;

public class FetchOptions {

    public static final String S3_PROTOCOL_PREFIX = "s3://";
    public static final String DELIMITER = "/";

    public static final String USAGE_PROFILE = "Profile used to connect to the bucket (from ~/.s3cfg)";
    public static final String OPT_PROFILE = "-Y";
    public static final String LONGOPT_PROFILE = "--profile";
    @Option(name=OPT_PROFILE, aliases=LONGOPT_PROFILE, usage=USAGE_PROFILE)
    @Getter @Setter private String profileName = null;

    public static final String USAGE_S3CFG = "Path of the s3cmd style config file holding the profile (default: $S3CFG, ./.s3cfg, ~/.s3cfg)";
    public static final String OPT_S3CFG = "-C";
    public static final String LONGOPT_S3CFG = "--s3cfg";
    @Option(name=OPT_S3CFG, aliases=LONGOPT_S3CFG, usage=USAGE_S3CFG)
    @Getter @Setter private String s3cfg = null;

    public static final String USAGE_DRY_RUN = "Do not actually do anything, but show what would be done";
    public static final String OPT_DRY_RUN = "-n";
    public static final String LONGOPT_DRY_RUN = "--dry-run";
    @Option(name=OPT_DRY_RUN, aliases=LONGOPT_DRY_RUN, usage=USAGE_DRY_RUN)
    @Getter @Setter private boolean dryRun = false;

    public static final String USAGE_VERBOSE = "Verbose output";
    public static final String OPT_VERBOSE = "-v";
    public static final String LONGOPT_VERBOSE = "--verbose";
    @Option(name=OPT_VERBOSE, aliases=LONGOPT_VERBOSE, usage=USAGE_VERBOSE)
    @Getter @Setter private boolean verbose = false;

    public static final String USAGE_PREFIX = "Only fetch objects below this prefix";
    public static final String OPT_PREFIX = "-p";
    public static final String LONGOPT_PREFIX = "--prefix";
    @Option(name=OPT_PREFIX, aliases=LONGOPT_PREFIX, usage=USAGE_PREFIX)
    @Getter @Setter private String prefix = null;

    public boolean hasPrefix() { return prefix != null && prefix.length() > 0; }

    public static final String DEFAULT_SUFFIX = ".json.gz";
    public static final String USAGE_SUFFIX = "Only fetch objects whose keys end with this suffix (default " + DEFAULT_SUFFIX + ")";
    public static final String OPT_SUFFIX = "-s";
    public static final String LONGOPT_SUFFIX = "--suffix";
    @Option(name=OPT_SUFFIX, aliases=LONGOPT_SUFFIX, usage=USAGE_SUFFIX)
    @Getter @Setter private String suffix = DEFAULT_SUFFIX;

    public static final String USAGE_MAX_CONNECTIONS = "Maximum number of connections to S3 (default 100)";
    public static final String OPT_MAX_CONNECTIONS = "-m";
    public static final String LONGOPT_MAX_CONNECTIONS = "--max-connections";
    @Option(name=OPT_MAX_CONNECTIONS, aliases=LONGOPT_MAX_CONNECTIONS, usage=USAGE_MAX_CONNECTIONS)
    @Getter @Setter private int maxConnections = 100;

    public static final int DEFAULT_MAX_THREADS = 20;
    public static final String USAGE_MAX_THREADS = "Maximum number of concurrent downloads (default " + DEFAULT_MAX_THREADS + ")";
    public static final String OPT_MAX_THREADS = "-t";
    public static final String LONGOPT_MAX_THREADS = "--max-threads";
    @Option(name=OPT_MAX_THREADS, aliases=LONGOPT_MAX_THREADS, usage=USAGE_MAX_THREADS)
    @Getter @Setter private int maxThreads = DEFAULT_MAX_THREADS;

    public static final String USAGE_MAX_KEYS = "Maximum number of keys requested per listing page (default 1000)";
    public static final String OPT_MAX_KEYS = "-k";
    public static final String LONGOPT_MAX_KEYS = "--max-keys";
    @Option(name=OPT_MAX_KEYS, aliases=LONGOPT_MAX_KEYS, usage=USAGE_MAX_KEYS)
    @Getter @Setter private int maxKeys = 1000;

    public static final String USAGE_CTIME = "Only fetch objects whose Last-Modified date is younger than this many days. " +
            "For other time units, use these suffixes: y (years), M (months), d (days), w (weeks), h (hours), m (minutes), s (seconds)";
    public static final String OPT_CTIME = "-c";
    public static final String LONGOPT_CTIME = "--ctime";
    @Option(name=OPT_CTIME, aliases=LONGOPT_CTIME, usage=USAGE_CTIME)
    @Getter @Setter private String ctime = null;
    public boolean hasCtime() { return ctime != null; }

    @Getter private long maxAge;
    @Getter private String maxAgeDate;

    public static final String USAGE_NO_DECOMPRESS = "Leave fetched files compressed";
    public static final String LONGOPT_NO_DECOMPRESS = "--no-decompress";
    @Option(name=LONGOPT_NO_DECOMPRESS, usage=USAGE_NO_DECOMPRESS)
    @Getter @Setter private boolean noDecompress = false;

    public static final String USAGE_ARCHIVE_KEY = "Zip the local directory when done and upload it to the bucket under this key";
    public static final String LONGOPT_ARCHIVE_KEY = "--archive-key";
    @Option(name=LONGOPT_ARCHIVE_KEY, usage=USAGE_ARCHIVE_KEY)
    @Getter @Setter private String archiveKey = null;
    public boolean hasArchiveKey() { return archiveKey != null && archiveKey.length() > 0; }

    private static final String USAGE_DISABLE_CERT_CHECK = "Disable checking of TLS certificates";
    public static final String LONGOPT_DISABLE_CERT_CHECK = "--disable-cert-check";
    @Option(name=LONGOPT_DISABLE_CERT_CHECK, usage=USAGE_DISABLE_CERT_CHECK)
    @Getter @Setter private boolean disableCertCheck = false;

    @Argument(index=0, required=true, usage="Bucket with optional prefix", metaVar = "<bucket[/prefix]>")
    @Getter @Setter private String bucket;
    @Argument(index=1, required=true, usage="Local directory the objects are fetched into", metaVar = "<local directory>")
    @Getter @Setter private String localDirectory;

    @Getter private final FetchProfile profile = new FetchProfile();

    @Getter private long nowTime = System.currentTimeMillis();

    public Path getLocalRoot() { return new File(localDirectory).toPath().toAbsolutePath().normalize(); }

    private long initMaxAge() {

        DateTime dateTime = new DateTime(nowTime);

        // all digits -- assume "days"
        if (ctime.matches("^[0-9]+$")) return dateTime.minusDays(Integer.parseInt(ctime)).getMillis();

        // ensure there is at least one digit, and exactly one character suffix, and the suffix is a legal option
        if (!ctime.matches("^[0-9]+[yMwdhms]$")) throw new IllegalArgumentException("Invalid option for ctime: "+ctime);

        if (ctime.endsWith("y")) return dateTime.minusYears(getCtimeNumber(ctime)).getMillis();
        if (ctime.endsWith("M")) return dateTime.minusMonths(getCtimeNumber(ctime)).getMillis();
        if (ctime.endsWith("w")) return dateTime.minusWeeks(getCtimeNumber(ctime)).getMillis();
        if (ctime.endsWith("d")) return dateTime.minusDays(getCtimeNumber(ctime)).getMillis();
        if (ctime.endsWith("h")) return dateTime.minusHours(getCtimeNumber(ctime)).getMillis();
        if (ctime.endsWith("m")) return dateTime.minusMinutes(getCtimeNumber(ctime)).getMillis();
        if (ctime.endsWith("s")) return dateTime.minusSeconds(getCtimeNumber(ctime)).getMillis();
        throw new IllegalArgumentException("Invalid option for ctime: "+ctime);
    }

    private int getCtimeNumber(String ctime) {
        return Integer.parseInt(ctime.substring(0, ctime.length() - 1));
    }

    public void initDerivedFields() {

        if (hasCtime()) {
            this.maxAge = initMaxAge();
            this.maxAgeDate = new Date(maxAge).toString();
        }

        if (maxThreads < 1) throw new IllegalArgumentException("Invalid option for "+LONGOPT_MAX_THREADS+": "+maxThreads);
        if (maxKeys < 1) throw new IllegalArgumentException("Invalid option for "+LONGOPT_MAX_KEYS+": "+maxKeys);
        if (suffix == null || suffix.length() == 0) throw new IllegalArgumentException("Empty "+LONGOPT_SUFFIX);

        final String scrubbed = scrubS3ProtocolPrefix(bucket);
        final int slashPos = scrubbed.indexOf('/');
        if (slashPos == -1) {
            bucket = scrubbed;
        } else {
            bucket = scrubbed.substring(0, slashPos);
            if (hasPrefix()) throw new IllegalArgumentException("Cannot use a "+OPT_PREFIX+"/"+LONGOPT_PREFIX+" argument and bucket path that includes a prefix at the same time");
            prefix = scrubbed.substring(slashPos+1);
        }
    }

    protected String scrubS3ProtocolPrefix(String bucket) {
        bucket = bucket.trim();
        if (bucket.startsWith(S3_PROTOCOL_PREFIX)) {
            bucket = bucket.substring(S3_PROTOCOL_PREFIX.length());
        }
        return bucket;
    }
}
