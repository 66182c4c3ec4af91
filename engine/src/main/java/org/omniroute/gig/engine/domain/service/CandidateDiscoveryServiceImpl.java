package org.omniroute.gig.engine.domain.service;

import org.omniroute.gig.engine.domain.model.AllocationConfig;
import org.omniroute.gig.engine.domain.model.Candidate;
import org.omniroute.gig.engine.domain.model.EarningEstimate;
import org.omniroute.gig.engine.domain.model.GeoPoint;
import org.omniroute.gig.engine.domain.model.GigWorker;
import org.omniroute.gig.engine.domain.model.Task;
import org.omniroute.gig.engine.domain.model.VerificationStatus;
import org.omniroute.gig.engine.domain.model.WorkerState;
import org.omniroute.gig.engine.domain.model.WorkerStatus;
import org.omniroute.gig.engine.domain.model.WorkerType;
import org.omniroute.gig.engine.registry.WorkerStateRegistry;
import org.omniroute.gig.engine.spi.CollaboratorException;
import org.omniroute.gig.engine.spi.EarningCalculator;
import org.omniroute.gig.engine.spi.GeoService;
import org.omniroute.gig.engine.spi.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Implementation of CandidateDiscoveryService.
 * Applies hard eligibility constraints, then enriches survivors through the geo and pricing collaborators.
 */
public final class CandidateDiscoveryServiceImpl implements CandidateDiscoveryService {

    private static final Logger LOG = LoggerFactory.getLogger(CandidateDiscoveryServiceImpl.class);

    static final double FALLBACK_MINUTES_PER_KM = 3.0;
    static final String DEFAULT_VEHICLE_TYPE = "motorcycle";

    private final WorkerRepository workerRepository;
    private final WorkerStateRegistry registry;
    private final GeoService geoService;
    private final EarningCalculator earningCalculator;
    private final AllocationConfig config;

    public CandidateDiscoveryServiceImpl(WorkerRepository workerRepository, WorkerStateRegistry registry,
                                         GeoService geoService, EarningCalculator earningCalculator,
                                         AllocationConfig config) {
        this.workerRepository = Objects.requireNonNull(workerRepository, "workerRepository must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.geoService = Objects.requireNonNull(geoService, "geoService must not be null");
        this.earningCalculator = Objects.requireNonNull(earningCalculator, "earningCalculator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public List<Candidate> findCandidates(Task task) {
        GeoPoint location = task.getEffectiveLocation();
        Set<WorkerType> types = requiredWorkerTypes(task);
        double maxDistance = config.getMaxWorkerDistanceKm();

        List<GigWorker> workers = workerRepository.findOnlineWithinRadius(location, maxDistance, types);
        LOG.debug("Task {}: {} workers of {} within {}km", task.getId(), workers.size(), types, maxDistance);

        List<Candidate> candidates = new ArrayList<>(workers.size());
        for (GigWorker worker : workers) {
            String rejection = rejectionReason(worker, task);
            if (rejection != null) {
                LOG.debug("Worker {} rejected for task {}: {}", worker.getId(), task.getId(), rejection);
                continue;
            }

            Optional<WorkerState> state = registry.find(worker.getId());
            if (state.isEmpty() || !state.get().isOnline() || state.get().getLocation() == null) {
                LOG.debug("Worker {} rejected for task {}: not online in registry", worker.getId(), task.getId());
                continue;
            }
            WorkerState live = state.get();

            double distance = geoService.distanceKm(live.getLocation(), location);
            if (distance > maxDistance) {
                LOG.debug("Worker {} rejected for task {}: {}km away", worker.getId(), task.getId(),
                        String.format("%.2f", distance));
                continue;
            }

            int eta = estimateEta(live.getLocation(), location, worker, distance);

            EarningEstimate earning;
            try {
                earning = earningCalculator.calculate(task, worker, distance);
            } catch (CollaboratorException e) {
                LOG.warn("Failed to calculate earning for worker {} on task {}: {}",
                        worker.getId(), task.getId(), e.getMessage());
                continue;
            }

            candidates.add(new Candidate(worker, distance, eta, earning, live.getActiveTaskCount()));
        }

        LOG.debug("Task {}: {} candidates found", task.getId(), candidates.size());
        return candidates;
    }

    @Override
    public Set<WorkerType> requiredWorkerTypes(Task task) {
        switch (task.getType()) {
            case DELIVERY:
                if (task.getTotalWeight() > config.getHeavyLoadKg()) {
                    return EnumSet.of(WorkerType.DRIVER);
                }
                if (task.getTotalWeight() > config.getMediumLoadKg()) {
                    return EnumSet.of(WorkerType.DRIVER, WorkerType.RIDER);
                }
                return EnumSet.of(WorkerType.DRIVER, WorkerType.RIDER, WorkerType.CYCLIST);
            case COLLECTION:
                return EnumSet.of(WorkerType.COLLECTOR, WorkerType.DRIVER, WorkerType.RIDER);
            case SURVEY:
                return EnumSet.of(WorkerType.SURVEYOR, WorkerType.WALKER);
            case MERCHANDISING:
                return EnumSet.of(WorkerType.MERCHANDISER, WorkerType.WALKER);
            default:
                return EnumSet.of(WorkerType.DRIVER, WorkerType.RIDER);
        }
    }

    /**
     * Check the hard constraints a worker must meet before scoring.
     *
     * @return a short description of the first failed constraint, or null if eligible
     */
    String rejectionReason(GigWorker worker, Task task) {
        if (worker.getStatus() != WorkerStatus.ACTIVE) {
            return "status " + worker.getStatus();
        }
        if (worker.getVerificationStatus() != VerificationStatus.APPROVED) {
            return "verification " + worker.getVerificationStatus();
        }
        if (worker.getRating() < config.getMinWorkerRating()) {
            return "rating below " + config.getMinWorkerRating();
        }
        if (!worker.getTaskPreferences().accepts(task.getType())) {
            return "does not take " + task.getType() + " tasks";
        }
        if (task.getTotalWeight() > 0 && worker.getVehicle() != null
                && worker.getVehicle().getCapacityKg() < task.getTotalWeight()) {
            return "vehicle capacity " + worker.getVehicle().getCapacityKg() + "kg";
        }
        if (task.requiresCashCollection() && !worker.getTaskPreferences().isAcceptCod()) {
            return "does not collect cash";
        }
        return null;
    }

    private int estimateEta(GeoPoint from, GeoPoint to, GigWorker worker, double distance) {
        String vehicleType = worker.getVehicle() != null ? worker.getVehicle().getType() : DEFAULT_VEHICLE_TYPE;
        try {
            return geoService.etaMinutes(from, to, vehicleType);
        } catch (CollaboratorException e) {
            LOG.warn("Failed to calculate ETA for worker {}: {}", worker.getId(), e.getMessage());
            return (int) (distance * FALLBACK_MINUTES_PER_KM);
        }
    }
}
