package dev.pekelund.carereport.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Stores blobs below a local directory. Content lives under {@code blobs/<key>} and metadata in a
 * properties file under {@code metadata/<key>.properties}. Both files are written to a temporary file
 * first and moved into place.
 */
public class FileSystemReportBlobStore implements ReportBlobStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemReportBlobStore.class);
    private static final String CONTENT_TYPE_PROPERTY = "__content-type";
    private static final String METADATA_SUFFIX = ".properties";

    private final Path root;
    private final Path blobRoot;
    private final Path metadataRoot;

    public FileSystemReportBlobStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.blobRoot = this.root.resolve("blobs");
        this.metadataRoot = this.root.resolve("metadata");
        try {
            Files.createDirectories(blobRoot);
            Files.createDirectories(metadataRoot);
        } catch (IOException ex) {
            throw new ReportStorageException("Unable to create report storage directory " + this.root, ex);
        }
    }

    @Override
    public void put(String key, byte[] content, String contentType, Map<String, String> metadata) {
        Path blobPath = resolve(blobRoot, key, "");
        Path metadataPath = resolve(metadataRoot, key, METADATA_SUFFIX);
        Properties properties = new Properties();
        if (metadata != null) {
            properties.putAll(metadata);
        }
        if (StringUtils.hasText(contentType)) {
            properties.setProperty(CONTENT_TYPE_PROPERTY, contentType);
        }
        try {
            writeAtomically(metadataPath, out -> properties.store(out, null));
            writeAtomically(blobPath, out -> out.write(content != null ? content : new byte[0]));
            LOGGER.debug("Wrote {} ({} bytes)", blobPath, content != null ? content.length : 0);
        } catch (IOException ex) {
            throw new ReportStorageException("Failed to write " + key + " below " + root, ex);
        }
    }

    @Override
    public Optional<StoredBlob> get(String key) {
        Path blobPath = resolve(blobRoot, key, "");
        try {
            byte[] content = Files.readAllBytes(blobPath);
            Properties properties = readMetadata(key);
            FileTime modified = Files.getLastModifiedTime(blobPath);
            return Optional.of(new StoredBlob(key, content, properties.getProperty(CONTENT_TYPE_PROPERTY),
                toMetadata(properties), modified.toInstant()));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (IOException ex) {
            throw new ReportStorageException("Failed to read " + key + " below " + root, ex);
        }
    }

    @Override
    public List<BlobListing> list(String prefix) {
        String normalizedPrefix = prefix != null ? prefix : "";
        List<BlobListing> listings = new ArrayList<>();
        List<Path> regularFiles;
        try (Stream<Path> files = Files.walk(blobRoot)) {
            regularFiles = files.filter(Files::isRegularFile)
                .filter(path -> !path.getFileName().toString().startsWith("."))
                .toList();
        } catch (IOException ex) {
            throw new ReportStorageException("Unable to list " + normalizedPrefix + " below " + root, ex);
        }
        for (Path file : regularFiles) {
            String key = blobRoot.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
            if (!key.startsWith(normalizedPrefix)) {
                continue;
            }
            try {
                Properties properties = readMetadata(key);
                listings.add(new BlobListing(key, Files.size(file), properties.getProperty(CONTENT_TYPE_PROPERTY),
                    toMetadata(properties), Files.getLastModifiedTime(file).toInstant()));
            } catch (NoSuchFileException ex) {
                LOGGER.debug("Entry {} disappeared while listing {}", key, normalizedPrefix);
            } catch (IOException ex) {
                throw new ReportStorageException("Unable to read " + key + " below " + root, ex);
            }
        }
        return listings;
    }

    @Override
    public boolean delete(String key) {
        try {
            boolean deleted = Files.deleteIfExists(resolve(blobRoot, key, ""));
            Files.deleteIfExists(resolve(metadataRoot, key, METADATA_SUFFIX));
            return deleted;
        } catch (IOException ex) {
            throw new ReportStorageException("Failed to delete " + key + " below " + root, ex);
        }
    }

    @Override
    public String describe() {
        return root.toUri().toString();
    }

    private Properties readMetadata(String key) throws IOException {
        Properties properties = new Properties();
        Path metadataPath = resolve(metadataRoot, key, METADATA_SUFFIX);
        if (Files.exists(metadataPath)) {
            try (InputStream in = Files.newInputStream(metadataPath)) {
                properties.load(in);
            }
        }
        return properties;
    }

    private static Map<String, String> toMetadata(Properties properties) {
        Map<String, String> metadata = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            if (!CONTENT_TYPE_PROPERTY.equals(name)) {
                metadata.put(name, properties.getProperty(name));
            }
        }
        return metadata;
    }

    private Path resolve(Path base, String key, String suffix) {
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException("A blob key is required");
        }
        Path resolved = base.resolve(key + suffix).normalize();
        if (!resolved.startsWith(base)) {
            throw new IllegalArgumentException("Blob key escapes the storage directory: " + key);
        }
        return resolved;
    }

    private static void writeAtomically(Path target, ContentWriter writer) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".tmp-", null);
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                writer.write(out);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @FunctionalInterface
    private interface ContentWriter {
        void write(OutputStream out) throws IOException;
    }
}
