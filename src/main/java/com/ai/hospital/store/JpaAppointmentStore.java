package com.ai.hospital.store;

import com.ai.hospital.domain.AppointmentRecord;
import com.ai.hospital.domain.AppointmentSnapshot;
import com.ai.hospital.entity.Appointment;
import com.ai.hospital.entity.StoreState;
import com.ai.hospital.repository.AppointmentRepository;
import com.ai.hospital.repository.StoreStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded-database store. Appointment rows plus one {@link StoreState} row; a commit locks
 * that row, compares its version with the snapshot's and writes everything in one transaction.
 */
@Component
@ConditionalOnProperty(prefix = "scheduling.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaAppointmentStore implements AppointmentStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAppointmentStore.class);

    static final long STATE_ID = 1L;
    static final String NO_STATE = "none";
    static final String UNREADABLE = "unreadable";

    private final AppointmentRepository appointmentRepository;
    private final StoreStateRepository stateRepository;
    private final TransactionTemplate readTransaction;
    private final TransactionTemplate writeTransaction;
    private final Clock clock;

    public JpaAppointmentStore(AppointmentRepository appointmentRepository,
                               StoreStateRepository stateRepository,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.appointmentRepository = appointmentRepository;
        this.stateRepository = stateRepository;
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public AppointmentSnapshot reload() {
        try {
            return readTransaction.execute(status -> {
                // state first: rows committed after this read only make the snapshot stricter
                StoreState state = stateRepository.findById(STATE_ID).orElse(null);
                Map<String, AppointmentRecord> records = new LinkedHashMap<>();
                for (Appointment a : appointmentRepository.findAll()) {
                    records.put(a.getId(), toRecord(a));
                }
                if (state == null) {
                    return new AppointmentSnapshot(records, 0, null, NO_STATE, false);
                }
                return new AppointmentSnapshot(
                        records,
                        state.getCounter(),
                        state.getLastUpdated(),
                        String.valueOf(state.getVersion()),
                        false);
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Appointment database unreadable, continuing with an empty snapshot", e);
            return AppointmentSnapshot.degraded(UNREADABLE);
        }
    }

    @Override
    public void commit(AppointmentSnapshot snapshot) {
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            writeTransaction.executeWithoutResult(status -> {
                StoreState state = stateRepository.findByIdForUpdate(STATE_ID).orElse(null);
                String current = state == null ? NO_STATE : String.valueOf(state.getVersion());
                if (!Objects.equals(current, snapshot.getBaseVersion())) {
                    throw new StaleSnapshotException(snapshot.getBaseVersion(), current);
                }
                if (state == null) {
                    state = StoreState.builder().id(STATE_ID).build();
                }

                List<Appointment> changed = snapshot.changedIds().stream()
                        .map(id -> toEntity(snapshot.find(id).orElseThrow()))
                        .toList();
                appointmentRepository.saveAll(changed);

                state.setCounter(snapshot.getCounter());
                state.setRevision(state.getRevision() + 1);
                state.setLastUpdated(now);
                stateRepository.saveAndFlush(state);
                log.debug("Committed {} appointment(s), counter={}", changed.size(), snapshot.getCounter());
            });
        } catch (OptimisticLockingFailureException | PessimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new StaleSnapshotException("Concurrent commit detected", e);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreWriteException("Appointment commit failed", e);
        }
        snapshot.markCommitted(now);
    }

    private static AppointmentRecord toRecord(Appointment a) {
        if (a.getStatus() == null || !a.getStatus().isPersistable()) {
            throw new UnmigratableRecordException(a.getId(), "stored status " + a.getStatus());
        }
        return AppointmentRecord.builder()
                .id(a.getId())
                .userId(a.getUserId())
                .patientName(a.getPatientName())
                .patientAge(a.getPatientAge())
                .patientGender(a.getPatientGender())
                .department(a.getDepartment())
                .doctor(a.getDoctor())
                .date(a.getAppointmentDate())
                .time(a.getAppointmentTime())
                .status(a.getStatus())
                .createdAt(a.getCreatedAt())
                .build();
    }

    private static Appointment toEntity(AppointmentRecord r) {
        return Appointment.builder()
                .id(r.getId())
                .userId(r.getUserId())
                .patientName(r.getPatientName())
                .patientAge(r.getPatientAge())
                .patientGender(r.getPatientGender())
                .department(r.getDepartment())
                .doctor(r.getDoctor())
                .appointmentDate(r.getDate())
                .appointmentTime(r.getTime())
                .status(r.getStatus())
                .createdAt(r.getCreatedAt())
                .build();
    }
}
