package org.cobbzilla.s3fetch;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.regions.Regions;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

public class FetchProfile implements AWSCredentials {

    // These are for AWSCredentials
    @Getter @Setter private String aWSAccessKeyId;
    @Getter @Setter private String aWSSecretKey;
    @Getter @Setter private String signerType;
    @Getter @Setter private String region = Regions.US_EAST_1.getName();

    // Our fields
    @Getter @Setter private String name;
    @Getter @Setter private String endpoint;

    @Getter @Setter private String proxyHost = null;
    @Getter @Setter private int proxyPort = -1;

    @Getter private final List<FetchProfileOptions> options = new ArrayList<FetchProfileOptions>();

    public boolean hasProxy() {
        boolean hasProxyHost = proxyHost != null && proxyHost.trim().length() > 0;
        boolean hasProxyPort = proxyPort != -1;

        return hasProxyHost && hasProxyPort;
    }

    public boolean isValid() {
        return name != null && aWSAccessKeyId != null && aWSSecretKey != null && endpoint != null;
    }

    public void addOption(FetchProfileOptions option) {
        options.add(option);
    }

    public boolean hasOption(FetchProfileOptions option) {
        return options.contains(option);
    }
}
