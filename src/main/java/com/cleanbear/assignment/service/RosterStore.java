package com.cleanbear.assignment.service;

import com.cleanbear.assignment.dto.TechnicianRecord;
import com.cleanbear.assignment.exception.RosterUnavailableException;
import com.cleanbear.assignment.model.Technician;
import com.cleanbear.assignment.repository.TechnicianRosterRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide technician roster. Loaded once at startup and then refreshed on a
 * fixed delay; each reload is published as a whole new snapshot, and a failed or
 * empty reload keeps the previous one.
 */
@Service
public class RosterStore {

    private static final Logger logger = LoggerFactory.getLogger(RosterStore.class);

    private final TechnicianRosterRepository rosterRepository;
    private final RequestMapper requestMapper;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    public RosterStore(TechnicianRosterRepository rosterRepository, RequestMapper requestMapper) {
        this.rosterRepository = rosterRepository;
        this.requestMapper = requestMapper;
    }

    @PostConstruct
    public void initialLoad() {
        if (!rosterRepository.isConfigured()) {
            logger.info("No roster spreadsheet configured; technicians must be sent with each request");
            return;
        }
        try {
            refresh();
        } catch (RosterUnavailableException e) {
            logger.error("Initial roster load failed, starting with an empty roster", e);
        }
    }

    @Scheduled(fixedDelayString = "${roster.refresh-interval-ms:300000}",
            initialDelayString = "${roster.refresh-interval-ms:300000}")
    public void scheduledRefresh() {
        if (!rosterRepository.isConfigured()) {
            return;
        }
        try {
            refresh();
        } catch (RosterUnavailableException e) {
            logger.warn("Scheduled roster refresh failed, keeping {} cached technicians: {}",
                    snapshot.get().technicians.size(), e.getMessage());
        }
    }

    /**
     * Reloads the roster now and returns the number of technicians being served.
     *
     * @throws RosterUnavailableException when no roster is configured or the source cannot be read;
     *                                    the previous snapshot stays in place
     */
    public int refresh() {
        if (!rosterRepository.isConfigured()) {
            throw new RosterUnavailableException("No roster spreadsheet configured (sheets.spreadsheet-id)");
        }

        List<TechnicianRecord> records = rosterRepository.fetchTechnicians();
        Snapshot current = snapshot.get();

        if (records.isEmpty() && !current.technicians.isEmpty()) {
            logger.warn("Roster reload returned no technicians, keeping {} cached", current.technicians.size());
            return current.technicians.size();
        }

        List<Technician> technicians = List.copyOf(requestMapper.toTechnicians(records));
        snapshot.set(new Snapshot(technicians, Instant.now()));
        logger.info("Roster refreshed: {} technicians", technicians.size());
        return technicians.size();
    }

    public List<Technician> currentRoster() {
        return snapshot.get().technicians;
    }

    public boolean isLoaded() {
        return snapshot.get().refreshedAt != null;
    }

    /**
     * Time of the last successful reload, or null before the first one.
     */
    public Instant getLastRefreshedAt() {
        return snapshot.get().refreshedAt;
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(List.of(), null);

        final List<Technician> technicians;
        final Instant refreshedAt;

        Snapshot(List<Technician> technicians, Instant refreshedAt) {
            this.technicians = technicians;
            this.refreshedAt = refreshedAt;
        }
    }
}
