package com.libragraph.datasink.core.storage;

import com.libragraph.datasink.util.ContentHash;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Filesystem-backed BinaryStore for development and testing.
 *
 * <p>Layout: {@code {root}/{tier1}/{tier2}/{datasetId}} where tier1 = id[0:2],
 * tier2 = id[2:4]. Writes go to a temp file that is then moved into place, so a
 * reader never sees a half-written payload.
 */
@ApplicationScoped
@IfBuildProperty(name = "datasink.binary-store.type", stringValue = "filesystem")
public class FilesystemBinaryStore implements BinaryStore {

    @ConfigProperty(name = "datasink.binary-store.filesystem.root")
    String root;

    private Path resolvePath(String datasetId) {
        if (datasetId.length() < 4 || datasetId.contains("/") || datasetId.contains("..")) {
            throw new StorageException("Invalid dataset id for filesystem store: " + datasetId);
        }
        return Path.of(root, datasetId.substring(0, 2), datasetId.substring(2, 4), datasetId);
    }

    @Override
    public Uni<Optional<BinaryRecord>> get(String datasetId) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(datasetId);
            if (!Files.exists(path)) {
                return Optional.<BinaryRecord>empty();
            }
            try {
                return Optional.of(BinaryRecord.of(datasetId, Files.readAllBytes(path)));
            } catch (IOException e) {
                throw StorageException.forDataset("read", datasetId, e);
            }
        });
    }

    @Override
    public Uni<ContentHash> put(String datasetId, byte[] data) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(datasetId);
            try {
                Files.createDirectories(path.getParent());
                Path tmp = Files.createTempFile(path.getParent(), datasetId, ".tmp");
                try {
                    Files.write(tmp, data);
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } finally {
                    Files.deleteIfExists(tmp);
                }
                return ContentHash.of(data);
            } catch (IOException e) {
                throw StorageException.forDataset("write", datasetId, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String datasetId) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(datasetId);
            try {
                if (!Files.deleteIfExists(path)) {
                    throw new ContentNotFoundException(datasetId);
                }
                pruneEmptyParents(path.getParent(), Path.of(root));
            } catch (IOException e) {
                throw StorageException.forDataset("delete", datasetId, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String datasetId) {
        return Uni.createFrom().item(() -> Files.exists(resolvePath(datasetId)));
    }

    @Override
    public String backend() {
        return "filesystem";
    }

    private void pruneEmptyParents(Path dir, Path stop) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(stop)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            Files.delete(current);
            current = current.getParent();
        }
    }
}
