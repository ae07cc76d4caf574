package mailgate.adapter.out.storage.file;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import mailgate.core.model.oauth.ClientStoreException;
import mailgate.core.model.oauth.OAuthClient;
import mailgate.core.port.out.ClientRepository;

/**
 * Client registry persisted as a JSON array file.
 *
 * <p>The file is read once at construction and rewritten in full on every
 * registration. Writes go to a temporary file that is then moved over the
 * store, so a crash never leaves a truncated registry behind.
 *
 * <p>Writers are serialized by a lock. Readers never take it: they see an
 * immutable snapshot that is replaced only after the file write succeeds.
 */
public class JsonFileClientRepository implements ClientRepository {

    private static final Logger LOG = Logger.getLogger(JsonFileClientRepository.class);

    private final ObjectMapper mapper;
    private final Path storePath;
    final ReentrantLock writeLock = new ReentrantLock();
    private volatile Map<String, OAuthClient> clients = Map.of();

    public JsonFileClientRepository(ObjectMapper mapper, Path storePath) {
        this.mapper = mapper;
        this.storePath = storePath.toAbsolutePath();
        createParentDirectory();
        load();
    }

    @Override
    public Uni<Optional<OAuthClient>> findById(String clientId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(clients.get(clientId)));
    }

    @Override
    public Uni<Void> save(OAuthClient client) {
        return Uni.createFrom()
                .item(() -> {
                    writeLock.lock();
                    try {
                        final var updated = new LinkedHashMap<>(clients);
                        updated.put(client.clientId(), client);
                        try {
                            write(updated.values());
                        } catch (IOException e) {
                            throw new ClientStoreException("Failed to persist OAuth clients to " + storePath, e);
                        }
                        clients = Collections.unmodifiableMap(updated);
                        LOG.debugf("Persisted %d OAuth clients to %s", updated.size(), storePath);
                        return null;
                    } finally {
                        writeLock.unlock();
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .replaceWithVoid();
    }

    private void createParentDirectory() {
        final var parent = storePath.getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ClientStoreException("Failed to create client store directory " + parent, e);
        }
    }

    private void load() {
        if (!Files.exists(storePath)) {
            LOG.infof("No OAuth client store at %s, starting with an empty registry", storePath);
            return;
        }

        final JsonNode root;
        try {
            root = mapper.readTree(storePath.toFile());
        } catch (IOException e) {
            LOG.warnf("Failed to read OAuth client store %s: %s", storePath, e.getMessage());
            return;
        }
        if (root == null || !root.isArray()) {
            LOG.warnf("OAuth client store %s does not contain a JSON array, ignoring it", storePath);
            return;
        }

        final var loaded = new LinkedHashMap<String, OAuthClient>();
        int index = 0;
        for (JsonNode node : root) {
            try {
                final var client = mapper.treeToValue(node, OAuthClient.class);
                loaded.put(client.clientId(), client);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                LOG.warnf("Skipping malformed OAuth client record %d in %s: %s", index, storePath, e.getMessage());
            }
            index++;
        }
        clients = Collections.unmodifiableMap(loaded);
        LOG.infof("Loaded %d OAuth clients from %s", loaded.size(), storePath);
    }

    private void write(Collection<OAuthClient> snapshot) throws IOException {
        final var temp = Files.createTempFile(storePath.getParent(), storePath.getFileName().toString(), ".tmp");
        try {
            mapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
