package com.querylab.search.api;

import com.querylab.search.api.dto.CreateExperimentRequest;
import com.querylab.search.api.dto.TrackEventRequest;
import com.querylab.search.experiment.Experiment;
import com.querylab.search.experiment.ExperimentManager;
import com.querylab.search.experiment.ExperimentResults;
import com.querylab.search.experiment.ExperimentStatus;
import com.querylab.search.experiment.ExperimentValidationException;
import com.querylab.search.experiment.VariantAssignment;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ExperimentController {
    private final ExperimentManager experimentManager;

    public ExperimentController(ExperimentManager experimentManager) {
        this.experimentManager = experimentManager;
    }

    @PostMapping("/admin/experiments")
    public ResponseEntity<Experiment> create(@RequestBody CreateExperimentRequest request) {
        if (request == null) {
            throw new ExperimentValidationException("request body is required");
        }
        Experiment experiment = experimentManager.createExperiment(
            request.getName(),
            request.getDescription(),
            request.getVariants(),
            request.getTrafficPercentage(),
            request.getPrimaryMetric(),
            request.getOwner(),
            request.getHypothesis()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(experiment);
    }

    @GetMapping("/admin/experiments")
    public List<Experiment> list(@RequestParam(value = "status", required = false) String status) {
        ExperimentStatus filter;
        try {
            filter = ExperimentStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ExperimentValidationException("unknown status: " + status);
        }
        return experimentManager.listExperiments(filter);
    }

    @GetMapping("/admin/experiments/{name}")
    public Experiment get(@PathVariable("name") String name) {
        return experimentManager.getExperiment(name);
    }

    @PostMapping("/admin/experiments/{name}/start")
    public Experiment start(@PathVariable("name") String name) {
        return experimentManager.startExperiment(name);
    }

    @PostMapping("/admin/experiments/{name}/pause")
    public Experiment pause(@PathVariable("name") String name) {
        return experimentManager.pauseExperiment(name);
    }

    @PostMapping("/admin/experiments/{name}/stop")
    public Experiment stop(@PathVariable("name") String name) {
        return experimentManager.stopExperiment(name);
    }

    @PostMapping("/admin/experiments/{name}/cancel")
    public Experiment cancel(@PathVariable("name") String name) {
        return experimentManager.cancelExperiment(name);
    }

    @GetMapping("/admin/experiments/{name}/results")
    public ExperimentResults results(@PathVariable("name") String name) {
        return experimentManager.getResults(name);
    }

    @GetMapping("/experiments/{name}/variant")
    public VariantAssignment variant(@PathVariable("name") String name, @RequestParam("user_id") String userId) {
        VariantAssignment assignment = experimentManager.getVariant(name, userId);
        return assignment == null ? new VariantAssignment(null, Map.of(), name) : assignment;
    }

    @PostMapping("/experiments/{name}/events")
    public Map<String, Boolean> track(@PathVariable("name") String name, @RequestBody TrackEventRequest request) {
        if (request == null || request.getUserId() == null || request.getEventType() == null) {
            throw new ExperimentValidationException("user_id and event_type are required");
        }
        boolean tracked;
        if ("conversion".equals(request.getEventType())) {
            tracked = experimentManager.trackConversion(
                name,
                request.getUserId(),
                request.getValue(),
                request.getMetadata()
            );
        } else {
            tracked = experimentManager.trackEvent(
                name,
                request.getUserId(),
                request.getEventType(),
                request.getValue(),
                request.getMetadata()
            );
        }
        return Map.of("tracked", tracked);
    }
}
