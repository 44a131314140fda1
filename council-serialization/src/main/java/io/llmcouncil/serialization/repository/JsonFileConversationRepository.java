package io.llmcouncil.serialization.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmcouncil.core.conversation.Conversation;
import io.llmcouncil.core.conversation.ConversationMessage;
import io.llmcouncil.core.conversation.ConversationRepository;
import io.llmcouncil.core.conversation.ConversationSettings;
import io.llmcouncil.core.conversation.ConversationSummary;
import io.llmcouncil.core.council.CouncilResult;
import io.llmcouncil.core.exception.ConversationNotFoundException;
import io.llmcouncil.serialization.ConversationSerializer;
import io.llmcouncil.serialization.PersistenceException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/// {@link ConversationRepository} storing one JSON file per conversation.
///
/// Files live at `<directory>/<id>.json`. Writes go to a temporary sibling first and are
/// moved into place with an atomic rename, so a crashed write leaves the previous version
/// intact. File systems without atomic rename get a plain replace, logged as a warning.
///
/// Unreadable files are skipped when listing and logged.
///
/// @implNote Thread-safe within one process: all operations synchronize on the repository.
/// Concurrent writers from other processes are not coordinated.
public class JsonFileConversationRepository implements ConversationRepository {

    private static final Logger logger =
            Logger.getLogger(JsonFileConversationRepository.class.getName());

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    /// @param directory storage directory, created if missing
    /// @param mapper mapper configured via {@link ConversationSerializer#createMapper()}
    /// @throws PersistenceException if the directory cannot be created
    public JsonFileConversationRepository(Path directory, ObjectMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create storage directory " + directory, e);
        }
    }

    public JsonFileConversationRepository(Path directory) {
        this(directory, ConversationSerializer.createMapper());
    }

    @Override
    public synchronized Conversation create(String id, ConversationSettings settings) {
        Path file = fileFor(id);
        if (Files.exists(file)) {
            throw new IllegalStateException("Conversation already exists: " + id);
        }
        Conversation conversation = Conversation.create(id, settings);
        write(conversation);
        return conversation;
    }

    @Override
    public synchronized Optional<Conversation> find(String id) {
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public synchronized List<ConversationSummary> list() {
        List<ConversationSummary> summaries = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .forEach(
                            path -> {
                                try {
                                    summaries.add(read(path).summary());
                                } catch (PersistenceException e) {
                                    logger.warning(
                                            "Skipping unreadable conversation file "
                                                    + path
                                                    + ": "
                                                    + e.getMessage());
                                }
                            });
        } catch (IOException e) {
            throw new PersistenceException("Cannot list conversations in " + directory, e);
        }
        summaries.sort(Comparator.comparing(ConversationSummary::createdAt).reversed());
        return summaries;
    }

    @Override
    public Conversation appendUserMessage(String id, String content) {
        return update(id, c -> c.withMessage(new ConversationMessage.UserTurn(content, null)));
    }

    @Override
    public Conversation appendAssistantMessage(String id, CouncilResult result) {
        return update(id, c -> c.withMessage(ConversationMessage.CouncilTurn.from(result)));
    }

    @Override
    public Conversation updateTitle(String id, String title) {
        return update(id, c -> c.withTitle(title));
    }

    @Override
    public synchronized boolean delete(String id) {
        try {
            return Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new PersistenceException("Cannot delete conversation " + id, e);
        }
    }

    private synchronized Conversation update(String id, UnaryOperator<Conversation> change) {
        Conversation current = find(id).orElseThrow(() -> new ConversationNotFoundException(id));
        Conversation updated = change.apply(current);
        write(updated);
        return updated;
    }

    private Conversation read(Path file) {
        try {
            return mapper.readValue(file.toFile(), Conversation.class);
        } catch (IOException e) {
            throw new PersistenceException("Cannot read conversation file " + file, e);
        }
    }

    private void write(Conversation conversation) {
        Path target = fileFor(conversation.id());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), conversation);
            replace(temp, target);
        } catch (IOException e) {
            throw new PersistenceException("Cannot write conversation " + conversation.id(), e);
        }
    }

    private static void replace(Path temp, Path target) throws IOException {
        try {
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warning(
                    "Atomic move unsupported for " + target + ", falling back to plain replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path fileFor(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches() || id.startsWith(".")) {
            throw new IllegalArgumentException("Invalid conversation id: " + id);
        }
        return directory.resolve(id + EXTENSION);
    }
}
