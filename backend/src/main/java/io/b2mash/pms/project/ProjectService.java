package io.b2mash.pms.project;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.exception.ResourceNotFoundException;
import io.b2mash.pms.security.AccessPolicy;
import io.b2mash.pms.security.Caller;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository repository;
  private final ProjectListQuery projectListQuery;
  private final ProjectValidator projectValidator;
  private final AccessPolicy accessPolicy;

  public ProjectService(
      ProjectRepository repository,
      ProjectListQuery projectListQuery,
      ProjectValidator projectValidator,
      AccessPolicy accessPolicy) {
    this.repository = repository;
    this.projectListQuery = projectListQuery;
    this.projectValidator = projectValidator;
    this.accessPolicy = accessPolicy;
  }

  public record NewProject(
      String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      ProjectStatus status) {}

  /** Partial update. Null means "not supplied". */
  public record ProjectChanges(
      String name,
      String description,
      LocalDate startDate,
      LocalDate endDate,
      ProjectStatus status) {}

  /**
   * Lists projects. {@code userId} narrows to one creator. Non-privileged callers are always
   * narrowed to themselves as well, so asking for another creator yields an empty page.
   */
  @Transactional(readOnly = true)
  public PagedResponse<ProjectView> listProjects(
      Caller caller, ProjectStatus status, String search, UUID userId, PageWindow window) {
    accessPolicy.projectAccess(caller).orThrow();
    UUID createdBy = userId;
    if (!caller.roles().isPrivileged()) {
      if (userId != null && !caller.isSelf(userId)) {
        return PagedResponse.of(List.of(), 0, window.limit(), window.offset());
      }
      createdBy = caller.userId();
    }
    return projectListQuery.execute(new ProjectListQuery.Filter(status, search, createdBy), window);
  }

  @Transactional(readOnly = true)
  public ProjectView getProject(Caller caller, UUID id) {
    var project = requireAccessible(caller, id);
    return view(project);
  }

  @Transactional
  public ProjectView createProject(Caller caller, NewProject request) {
    accessPolicy.projectAccess(caller).orThrow();
    ProjectStatus status = request.status() != null ? request.status() : ProjectStatus.PENDING;
    projectValidator.validate(
        request.startDate(),
        request.endDate(),
        status,
        request.endDate() != null,
        caller.roles().isPrivileged());

    var project =
        repository.save(
            new Project(
                request.name(),
                request.description(),
                request.startDate(),
                request.endDate(),
                status,
                caller.userId()));
    log.info("Created project {} by user {}", project.getId(), caller.userId());
    return view(project);
  }

  /** Validates the merged result before touching the entity; a rejected update changes nothing. */
  @Transactional
  public ProjectView updateProject(Caller caller, UUID id, ProjectChanges changes) {
    var project = requireAccessible(caller, id);

    LocalDate startDate =
        changes.startDate() != null ? changes.startDate() : project.getStartDate();
    LocalDate endDate = changes.endDate() != null ? changes.endDate() : project.getEndDate();
    ProjectStatus status = changes.status() != null ? changes.status() : project.getStatus();
    projectValidator.validate(
        startDate, endDate, status, changes.endDate() != null, caller.roles().isPrivileged());

    project.update(
        changes.name(),
        changes.description(),
        changes.startDate(),
        changes.endDate(),
        changes.status());
    project = repository.save(project);
    log.info("Updated project {} by user {}", id, caller.userId());
    return view(project);
  }

  @Transactional
  public ProjectView completeProject(Caller caller, UUID id) {
    var project = requireAccessible(caller, id);
    project.complete(LocalDate.now());
    project = repository.save(project);
    log.info("Completed project {} by user {}", id, caller.userId());
    return view(project);
  }

  @Transactional
  public void deleteProject(Caller caller, UUID id) {
    accessPolicy.projectDelete(caller).orThrow();
    var project =
        repository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Project", id));
    repository.delete(project);
    log.info("Deleted project {} by user {}", id, caller.userId());
  }

  /** Overview counts, scoped to the caller's own projects unless privileged. */
  @Transactional(readOnly = true)
  public ProjectStats getStats(Caller caller) {
    accessPolicy.projectAccess(caller).orThrow();
    if (caller.roles().isPrivileged()) {
      return ProjectStats.from(repository.countByStatus());
    }
    return ProjectStats.from(repository.countByStatusForCreator(caller.userId()));
  }

  /** Counts for the projects one user created, shown on their profile. */
  @Transactional(readOnly = true)
  public ProjectStats getStatsForCreator(UUID userId) {
    return ProjectStats.from(repository.countByStatusForCreator(userId));
  }

  private Project requireAccessible(Caller caller, UUID id) {
    accessPolicy.projectAccess(caller).orThrow();
    var project =
        repository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Project", id));
    accessPolicy.projectInstance(caller, project.getCreatedBy()).orThrow();
    return project;
  }

  private ProjectView view(Project project) {
    return new ProjectView(project, repository.findUserName(project.getCreatedBy()).orElse(null));
  }
}
