package com.factmarrow.service;

import com.factmarrow.config.FactMarrowProperties;
import com.factmarrow.model.StoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Writes uploaded documents to disk under a content-derived name.
 */
@Service
public class DocumentStorageService {

    private static final Logger log = LoggerFactory.getLogger(DocumentStorageService.class);

    static final int ID_LENGTH = 12;

    private final Path documentsDir;

    public DocumentStorageService(FactMarrowProperties properties) {
        this.documentsDir = Paths.get(properties.storage().documentsDir());
    }

    /**
     * Stores the document as {@code {hash}_{filename}}.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public StoredDocument store(String filename, byte[] content) {
        String documentId = contentId(content);
        String safeName = Paths.get(filename).getFileName().toString();
        Path target = documentsDir.resolve(documentId + "_" + safeName);
        try {
            Files.createDirectories(documentsDir);
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to store document '" + filename + "': " + e.getMessage(), e);
        }
        log.debug("Document saved to: {}", target);
        return new StoredDocument(documentId, safeName, target, content.length);
    }

    /** First {@value #ID_LENGTH} hex chars of the SHA-256 of the content. */
    public static String contentId(byte[] content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content);
            return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
