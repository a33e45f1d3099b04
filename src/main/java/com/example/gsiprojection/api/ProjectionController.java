package com.example.gsiprojection.api;

import com.example.gsiprojection.api.dto.ProjectionDtos.ProjectionInputs;
import com.example.gsiprojection.api.dto.ProjectionDtos.ProjectionResult;
import com.example.gsiprojection.service.ProjectionService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projections")
public class ProjectionController {
    // Application service that runs the projection against the configured reference portfolio
    private final ProjectionService projectionService;

    public ProjectionController(ProjectionService projectionService) {
        this.projectionService = projectionService;
    }

    // Accepts the ten projection parameters and returns the chart series and summary metrics
    @PostMapping
    public ProjectionResult project(@Valid @RequestBody ProjectionInputs inputs) {
        return projectionService.project(inputs);
    }
}
