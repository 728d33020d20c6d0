package com.varia.model;

import lombok.NonNull;
import lombok.Value;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Body of a stored response: either bytes held in memory or a file the store wrote to disk.
 */
public interface ResponseBody {

    static ResponseBody ofBytes(byte[] content) {
        return new Bytes(content);
    }

    static ResponseBody ofFile(Path path) {
        return new FileReference(path);
    }

    InputStream openStream() throws IOException;

    long size() throws IOException;

    @Value
    class Bytes implements ResponseBody {

        @NonNull
        byte[] content;

        /**
         * A copy; the held bytes may be shared with a store.
         */
        public byte[] getContent() {
            return content.clone();
        }

        @Override
        public InputStream openStream() {
            return new ByteArrayInputStream(content);
        }

        @Override
        public long size() {
            return content.length;
        }
    }

    @Value
    class FileReference implements ResponseBody {

        @NonNull
        Path path;

        @Override
        public InputStream openStream() throws IOException {
            return Files.newInputStream(path);
        }

        @Override
        public long size() throws IOException {
            return Files.size(path);
        }
    }
}
