package com.socialhub.backend.modules.profile.application;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Publishes a locally staged file and returns where clients can fetch it.
 */
public interface ObjectStorage {

    UploadResult upload(Path localFile) throws IOException;

    record UploadResult(String secureUrl) {
    }
}
