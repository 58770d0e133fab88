package org.cobbzilla.s3fetch;

import com.amazonaws.services.s3.AmazonS3;
import lombok.Getter;

public class FetchContext {

    @Getter private final FetchOptions options;
    @Getter private final AmazonS3 client;
    @Getter private final FetchStats stats = new FetchStats();

    public FetchContext(FetchOptions options, AmazonS3 client) {
        this.options = options;
        this.client = client;
    }
}
