package io.b2mash.pms.project;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('USER', 'MADMIN', 'ADMIN')")
  public ResponseEntity<PagedResponse<ProjectResponse>> listProjects(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) String search,
      @RequestParam(required = false) UUID userId,
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    ProjectStatus statusFilter = status != null ? ProjectStatus.fromValue(status) : null;
    var page =
        projectService.listProjects(
            RequestScopes.requireCaller(),
            statusFilter,
            search,
            userId,
            new PageWindow(limit, offset));
    return ResponseEntity.ok(page.map(ProjectResponse::from));
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('USER', 'MADMIN', 'ADMIN')")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ProjectResponse.from(projectService.getProject(RequestScopes.requireCaller(), id)));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('USER', 'MADMIN', 'ADMIN')")
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody CreateProjectRequest request) {
    var created =
        projectService.createProject(
            RequestScopes.requireCaller(),
            new ProjectService.NewProject(
                request.name(),
                request.description(),
                request.startDate(),
                request.endDate(),
                request.status()));
    return ResponseEntity.created(URI.create("/api/projects/" + created.project().getId()))
        .body(ProjectResponse.from(created));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('USER', 'MADMIN', 'ADMIN')")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID id, @Valid @RequestBody UpdateProjectRequest request) {
    var updated =
        projectService.updateProject(
            RequestScopes.requireCaller(),
            id,
            new ProjectService.ProjectChanges(
                request.name(),
                request.description(),
                request.startDate(),
                request.endDate(),
                request.status()));
    return ResponseEntity.ok(ProjectResponse.from(updated));
  }

  @PutMapping("/{id}/complete")
  @PreAuthorize("hasAnyRole('USER', 'MADMIN', 'ADMIN')")
  public ResponseEntity<ProjectResponse> completeProject(@PathVariable UUID id) {
    return ResponseEntity.ok(
        ProjectResponse.from(projectService.completeProject(RequestScopes.requireCaller(), id)));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<Void> deleteProject(@PathVariable UUID id) {
    projectService.deleteProject(RequestScopes.requireCaller(), id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/stats/overview")
  @PreAuthorize("hasAnyRole('USER', 'MADMIN', 'ADMIN')")
  public ResponseEntity<ProjectStats> getStats() {
    return ResponseEntity.ok(projectService.getStats(RequestScopes.requireCaller()));
  }

  // --- DTOs ---

  public record CreateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Size(max = 5000, message = "description must be at most 5000 characters")
          String description,
      @NotNull(message = "startDate is required") LocalDate startDate,
      LocalDate endDate,
      ProjectStatus status) {}

  public record UpdateProjectRequest(
      @Size(min = 1, max = 255, message = "name must be between 1 and 255 characters")
          String name,
      @Size(max = 5000, message = "description must be at most 5000 characters")
          String description,
      LocalDate startDate,
      LocalDate endDate,
      ProjectStatus status) {}

  public record ProjectResponse(
      UUID id,
      String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      ProjectStatus status,
      UUID createdBy,
      String createdByName,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(ProjectView view) {
      var project = view.project();
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getDescription(),
          project.getStartDate(),
          project.getEndDate(),
          project.getStatus(),
          project.getCreatedBy(),
          view.creatorName(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }
}
