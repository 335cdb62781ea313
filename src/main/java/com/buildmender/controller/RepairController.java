package com.buildmender.controller;

import com.buildmender.service.BuildRepairService;
import com.buildmender.service.RepairRequest;
import com.buildmender.service.RepairResponse;
import com.buildmender.source.SourceFetchException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/repair")
public class RepairController {

    private static final Logger log = LoggerFactory.getLogger(RepairController.class);

    private final BuildRepairService repairService;

    public RepairController(BuildRepairService repairService) {
        this.repairService = repairService;
    }

    @PostMapping("/update-and-build")
    public ResponseEntity<RepairResponse> updateAndBuild(
            @RequestBody RepairRequest request
    ) {

        if (request == null || !request.isComplete()) {
            return ResponseEntity.badRequest().build();
        }

        try {
            return ResponseEntity.ok(repairService.updateAndBuild(request));
        } catch (IllegalArgumentException e) {
            log.warn("[Controller] Rejected {}: {}", request, e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (SourceFetchException e) {
            log.error("[Controller] Source fetch failed for {}: {}", request.getProjectUrl(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(RepairResponse.failedBeforeSession("source-fetch", e.getMessage()));
        }
    }
}
