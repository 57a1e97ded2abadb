package com.dbtide.backend.controller;

import com.dbtide.backend.dto.ErrorResponse;
import com.dbtide.backend.dto.ProjectSummary;
import com.dbtide.backend.exception.ProjectLoadException;
import com.dbtide.backend.service.ProjectService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/project")
public class ProjectController {

    private static final Logger logger = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @GetMapping
    public ResponseEntity<ProjectSummary> summary() {
        return ResponseEntity.ok(projectService.index().summary());
    }

    @PostMapping("/reload")
    public ResponseEntity<?> reload() {
        try {
            return ResponseEntity.ok(projectService.reload().summary());
        } catch (ProjectLoadException e) {
            logger.warn("Project reload failed: {}", e.getMessage());
            return ResponseEntity.unprocessableEntity()
                .body(new ErrorResponse(e.getMessage(), HttpStatus.UNPROCESSABLE_ENTITY.value()));
        }
    }
}
