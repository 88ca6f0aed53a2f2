package com.ai.hospital.store;

import com.ai.hospital.config.SchedulingProperties;
import com.ai.hospital.domain.AppointmentRecord;
import com.ai.hospital.domain.AppointmentSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single JSON document store. Commits write a temp file and move it over the document while
 * an exclusive lock on a sibling {@code .lock} file is held, so readers only ever see a whole
 * document and concurrent writers from other processes are detected through the revision.
 */
@Component
@ConditionalOnProperty(prefix = "scheduling.store", name = "type", havingValue = "file")
public class JsonFileAppointmentStore implements AppointmentStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileAppointmentStore.class);

    static final String ABSENT = "absent";
    static final String UNREADABLE = "unreadable";

    private final Path dataFile;
    private final Path lockFile;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final ReentrantLock writeLock = new ReentrantLock();

    @Autowired
    public JsonFileAppointmentStore(SchedulingProperties properties, Clock clock) {
        this(Paths.get(properties.getStore().getFilePath()), clock);
    }

    public JsonFileAppointmentStore(Path dataFile, Clock clock) {
        this.dataFile = dataFile.toAbsolutePath();
        this.lockFile = this.dataFile.resolveSibling(this.dataFile.getFileName() + ".lock");
        this.clock = clock;
        log.info("Appointment file store at {}", this.dataFile);
    }

    @Override
    public AppointmentSnapshot reload() {
        if (!Files.exists(dataFile)) {
            return AppointmentSnapshot.empty(ABSENT);
        }
        StoreDocument document;
        try {
            document = mapper.readValue(dataFile.toFile(), StoreDocument.class);
        } catch (IOException e) {
            log.error("Appointment file {} unreadable, continuing with an empty snapshot", dataFile, e);
            return AppointmentSnapshot.degraded(UNREADABLE);
        }

        Map<String, AppointmentRecord> records = new LinkedHashMap<>();
        if (document.getAppointments() != null) {
            document.getAppointments().forEach((key, stored) -> {
                if (stored == null) {
                    throw new UnmigratableRecordException(key, "empty record");
                }
                AppointmentRecord record = stored.toRecord(key);
                records.put(record.getId(), record);
            });
        }
        return new AppointmentSnapshot(
                records,
                document.getCounter(),
                parseTimestamp(document.getLastUpdated()),
                String.valueOf(document.getRevision()),
                false);
    }

    @Override
    public void commit(AppointmentSnapshot snapshot) {
        writeLock.lock();
        try {
            Files.createDirectories(dataFile.getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {

                String current = currentRevision();
                if (!current.equals(snapshot.getBaseVersion())) {
                    throw new StaleSnapshotException(snapshot.getBaseVersion(), current);
                }
                if (UNREADABLE.equals(current)) {
                    Path backup = dataFile.resolveSibling(dataFile.getFileName() + ".corrupt");
                    Files.copy(dataFile, backup, StandardCopyOption.REPLACE_EXISTING);
                    log.warn("Replacing unreadable appointment file; previous content kept at {}", backup);
                }

                LocalDateTime now = LocalDateTime.now(clock);
                StoreDocument document = new StoreDocument();
                Map<String, StoredAppointment> appointments = new LinkedHashMap<>();
                snapshot.asMap().forEach((id, record) -> appointments.put(id, StoredAppointment.from(record)));
                document.setAppointments(appointments);
                document.setCounter(snapshot.getCounter());
                document.setLastUpdated(now.toString());
                document.setRevision(nextRevision(current));

                Path temp = Files.createTempFile(dataFile.getParent(), dataFile.getFileName().toString(), ".tmp");
                try {
                    mapper.writeValue(temp.toFile(), document);
                    Files.move(temp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } finally {
                    Files.deleteIfExists(temp);
                }
                snapshot.markCommitted(now);
                log.debug("Committed appointment file revision {}, counter={}", document.getRevision(), document.getCounter());
            }
        } catch (IOException e) {
            throw new StoreWriteException("Could not write appointment file " + dataFile, e);
        } finally {
            writeLock.unlock();
        }
    }

    private String currentRevision() {
        if (!Files.exists(dataFile)) {
            return ABSENT;
        }
        try {
            return String.valueOf(mapper.readValue(dataFile.toFile(), StoreDocument.class).getRevision());
        } catch (IOException e) {
            return UNREADABLE;
        }
    }

    private static long nextRevision(String current) {
        try {
            return Long.parseLong(current) + 1;
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value == null) return null;
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring malformed last_updated value '{}'", value);
            return null;
        }
    }
}
