package com.socialhub.backend.modules.profile.infrastructure.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

import com.socialhub.backend.modules.profile.application.ObjectStorage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Copies uploads into a directory served as static content. File names are random so a
 * published URL never points at a replaced picture.
 */
@Component
public class LocalObjectStorage implements ObjectStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalObjectStorage.class);

    private final Path root;
    private final String publicBaseUrl;

    public LocalObjectStorage(
            @Value("${app.storage.public-dir:uploads/public}") String publicDir,
            @Value("${app.storage.public-base-url:http://localhost:8080/static}") String publicBaseUrl
    ) {
        this.root = Paths.get(publicDir).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
                : publicBaseUrl;
    }

    @Override
    public UploadResult upload(Path localFile) throws IOException {
        Files.createDirectories(root);

        String name = UUID.randomUUID() + extensionOf(localFile);
        Path destination = root.resolve(name).normalize();
        if (!destination.startsWith(root)) {
            throw new IOException("Refusing to write outside storage root: " + destination);
        }
        Files.copy(localFile, destination, StandardCopyOption.REPLACE_EXISTING);
        log.info("Stored upload {} as {}", localFile.getFileName(), destination);
        return new UploadResult(publicBaseUrl + "/" + name);
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
