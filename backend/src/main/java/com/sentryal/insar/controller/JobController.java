package com.sentryal.insar.controller;

import com.sentryal.insar.ledger.JobLedger;
import com.sentryal.insar.model.DeformationSample;
import com.sentryal.insar.model.InsarJob;
import com.sentryal.insar.store.ResultStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobLedger jobLedger;
    private final ResultStore resultStore;

    @GetMapping
    public ResponseEntity<List<InsarJob>> listJobs(@RequestParam("infrastructureId") String infrastructureId) {
        return ResponseEntity.ok(jobLedger.findByInfrastructure(infrastructureId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InsarJob> getJob(@PathVariable String id) {
        return ResponseEntity.ok(jobLedger.find(id));
    }

    @GetMapping("/{id}/samples")
    public ResponseEntity<List<DeformationSample>> getSamples(@PathVariable String id) {
        jobLedger.find(id);
        return ResponseEntity.ok(resultStore.findByJob(id));
    }

    // Only flags the job; the worker holding it acts on the next tick.
    @PostMapping("/{id}/cancel")
    public ResponseEntity<InsarJob> cancelJob(@PathVariable String id) {
        return ResponseEntity.accepted().body(jobLedger.requestCancellation(id));
    }
}
