package org.cobbzilla.s3fetch;

import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.RandomUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.zip.GZIPOutputStream;

import static java.nio.charset.StandardCharsets.UTF_8;

class TestObject {

    public final String key;
    public final String data;
    public final byte[] compressed;

    private TestObject(String key, String data) {
        this.key = key;
        this.data = data;
        this.compressed = gzip(data.getBytes(UTF_8));
    }

    public static TestObject create(String key, int size) {
        return new TestObject(key, randomJson(size));
    }

    public static String randomJson(int size) {
        return "{\"id\":\"" + RandomStringUtils.randomAlphanumeric(10) + "\",\"payload\":\""
                + RandomStringUtils.randomAlphanumeric(size + RandomUtils.nextInt(0, 1024)) + "\"}\n";
    }

    public static byte[] gzip(byte[] data) {
        try {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            try (GZIPOutputStream gz = new GZIPOutputStream(bytes)) {
                gz.write(data);
            }
            return bytes.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    /** The first half of a compressed stream: a valid header, then the data just stops. */
    public byte[] truncated() {
        return Arrays.copyOf(compressed, compressed.length / 2);
    }

    static FetchOptions options(String bucket, String localDirectory) {
        final FetchOptions options = new FetchOptions();
        options.setBucket(bucket);
        options.setLocalDirectory(localDirectory);
        options.initDerivedFields();
        return options;
    }
}
