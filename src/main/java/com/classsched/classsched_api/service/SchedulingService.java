package com.classsched.classsched_api.service;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.classsched.classsched_api.config.PresetResolver;
import com.classsched.classsched_api.config.SchedulerProperties;
import com.classsched.classsched_api.dto.SolveRequest;
import com.classsched.classsched_api.exception.DataIntegrityException;
import com.classsched.classsched_api.model.TimetableInput;
import com.classsched.classsched_api.solver.TimetableSolver;
import com.classsched.classsched_api.solver.conflict.ResolvedProblem;
import com.classsched.classsched_api.solver.optimizer.ScheduleResult;
import com.classsched.classsched_api.solver.optimizer.SolverPreset;

import ai.timefold.solver.core.api.solver.SolverStatus;

@Service
public class SchedulingService {
    private static final Logger logger = LoggerFactory.getLogger(SchedulingService.class);

    private final TimetableSolver timetableSolver;
    private final PresetResolver presetResolver;
    private final ExecutorService jobExecutor;
    private final ConcurrentMap<String, SolverStatus> solverStatusMap = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ScheduleResult> resultMap = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> failureMap = new ConcurrentHashMap<>();
    // Finished jobs, oldest first
    private final ConcurrentLinkedQueue<String> finishedJobs = new ConcurrentLinkedQueue<>();
    private final int retainedJobs;

    public SchedulingService(TimetableSolver timetableSolver, PresetResolver presetResolver,
                             SchedulerProperties properties,
                             @Qualifier("schedulingJobExecutor") ExecutorService jobExecutor) {
        this.timetableSolver = timetableSolver;
        this.presetResolver = presetResolver;
        this.retainedJobs = Math.max(1, properties.getRetainedJobs());
        this.jobExecutor = jobExecutor;
    }

    public SolverStatus getSolverStatus(String problemId) {
        return solverStatusMap.getOrDefault(problemId, SolverStatus.NOT_SOLVING);
    }

    /** Solves in the calling thread. */
    public ScheduleResult solve(SolveRequest request) {
        TimetableInput input = requireInput(request);
        SolverPreset preset = presetResolver.resolve(request);
        ResolvedProblem problem = timetableSolver.prepare(input);
        return timetableSolver.solve(problem, preset);
    }

    /**
     * Validates the request and queues it. Input and configuration errors are
     * thrown here; the search itself runs on the job executor.
     *
     * @return the problem id to poll
     */
    public String submit(SolveRequest request) {
        TimetableInput input = requireInput(request);
        SolverPreset preset = presetResolver.resolve(request);
        ResolvedProblem problem = timetableSolver.prepare(input);
        String problemId = UUID.randomUUID().toString();
        logger.info("Received scheduling job {} with preset '{}'", problemId, preset.getName());
        solverStatusMap.put(problemId, SolverStatus.SOLVING_SCHEDULED);

        jobExecutor.submit(() -> {
            solverStatusMap.put(problemId, SolverStatus.SOLVING_ACTIVE);
            try {
                ScheduleResult result = timetableSolver.solve(problem, preset);
                resultMap.put(problemId, result);
                logger.info("!!! Job {} finished with status {} !!!", problemId, result.getStatus());
            } catch (RuntimeException e) {
                logger.error("!!! SOLVING FAILED for problemId: {} !!!", problemId, e);
                failureMap.put(problemId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            } finally {
                solverStatusMap.put(problemId, SolverStatus.NOT_SOLVING);
                retire(problemId);
            }
        });
        return problemId;
    }

    /**
     * Result of a finished job; empty while it is still queued or running.
     *
     * @throws NoSuchElementException when the id was never submitted or its
     *         result has been evicted
     */
    public Optional<ScheduleResult> getResult(String problemId) {
        requireKnown(problemId);
        return Optional.ofNullable(resultMap.get(problemId));
    }

    public Optional<String> getFailure(String problemId) {
        requireKnown(problemId);
        return Optional.ofNullable(failureMap.get(problemId));
    }

    // Keeps only the most recent finished jobs
    private void retire(String problemId) {
        finishedJobs.add(problemId);
        while (finishedJobs.size() > retainedJobs) {
            String evicted = finishedJobs.poll();
            if (evicted == null) {
                break;
            }
            resultMap.remove(evicted);
            failureMap.remove(evicted);
            solverStatusMap.remove(evicted);
            logger.debug("Evicted finished job {}", evicted);
        }
    }

    private void requireKnown(String problemId) {
        if (!solverStatusMap.containsKey(problemId)) {
            throw new NoSuchElementException("No scheduling job with id " + problemId);
        }
    }

    private static TimetableInput requireInput(SolveRequest request) {
        if (request == null || request.getInput() == null) {
            throw new DataIntegrityException("Request has no input facts.");
        }
        return request.getInput();
    }
}
