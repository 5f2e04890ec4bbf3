package io.b2mash.pms.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.pms.common.PageWindow;
import io.b2mash.pms.common.PagedResponse;
import io.b2mash.pms.exception.ForbiddenException;
import io.b2mash.pms.exception.ResourceNotFoundException;
import io.b2mash.pms.exception.ValidationException;
import io.b2mash.pms.security.AccessPolicy;
import io.b2mash.pms.security.Caller;
import io.b2mash.pms.security.Role;
import io.b2mash.pms.security.RoleSet;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectServiceTest {

  private static final UUID USER_ID = UUID.randomUUID();
  private static final LocalDate START = LocalDate.of(2024, 5, 1);

  private static final Caller USER = new Caller(USER_ID, RoleSet.of(Role.USER));
  private static final Caller MADMIN = new Caller(UUID.randomUUID(), RoleSet.of(Role.MADMIN));
  private static final Caller STAFF = new Caller(UUID.randomUUID(), RoleSet.staffOnly());

  @Mock private ProjectRepository repository;
  @Mock private ProjectListQuery projectListQuery;
  @Spy private ProjectValidator projectValidator = new ProjectValidator();
  @Spy private AccessPolicy accessPolicy = new AccessPolicy();
  @InjectMocks private ProjectService service;

  @Test
  void listProjects_userIsScopedToOwnProjects() {
    var window = new PageWindow(10, 0);
    when(projectListQuery.execute(any(), eq(window)))
        .thenReturn(PagedResponse.of(List.of(), 0, 10, 0));

    service.listProjects(USER, null, null, null, window);

    var filter = ArgumentCaptor.forClass(ProjectListQuery.Filter.class);
    verify(projectListQuery).execute(filter.capture(), eq(window));
    assertThat(filter.getValue().createdBy()).isEqualTo(USER_ID);
  }

  @Test
  void listProjects_userFilteringOnAnotherCreatorGetsEmptyPage() {
    var page = service.listProjects(USER, null, null, UUID.randomUUID(), new PageWindow(10, 20));

    assertThat(page.items()).isEmpty();
    assertThat(page.pagination().total()).isZero();
    assertThat(page.pagination().limit()).isEqualTo(10);
    assertThat(page.pagination().offset()).isEqualTo(20);
    assertThat(page.pagination().hasMore()).isFalse();
    verifyNoInteractions(projectListQuery);
  }

  @Test
  void listProjects_userFilteringOnSelfIsScopedToOwnProjects() {
    var window = new PageWindow(10, 0);
    when(projectListQuery.execute(any(), eq(window)))
        .thenReturn(PagedResponse.of(List.of(), 0, 10, 0));

    service.listProjects(USER, null, null, USER_ID, window);

    var filter = ArgumentCaptor.forClass(ProjectListQuery.Filter.class);
    verify(projectListQuery).execute(filter.capture(), eq(window));
    assertThat(filter.getValue().createdBy()).isEqualTo(USER_ID);
  }

  @Test
  void listProjects_madminSeesEveryCreatorUnlessFiltered() {
    var window = new PageWindow(10, 0);
    when(projectListQuery.execute(any(), eq(window)))
        .thenReturn(PagedResponse.of(List.of(), 0, 10, 0));

    service.listProjects(MADMIN, ProjectStatus.ONGOING, null, null, window);

    var filter = ArgumentCaptor.forClass(ProjectListQuery.Filter.class);
    verify(projectListQuery).execute(filter.capture(), eq(window));
    assertThat(filter.getValue().createdBy()).isNull();
    assertThat(filter.getValue().status()).isEqualTo(ProjectStatus.ONGOING);
  }

  @Test
  void listProjects_staffOnlyIsDenied() {
    assertThatThrownBy(() -> service.listProjects(STAFF, null, null, null, new PageWindow(10, 0)))
        .isInstanceOf(ForbiddenException.class)
        .hasFieldOrPropertyWithValue("reason", "insufficient_role");
  }

  @Test
  void getProject_otherUsersProjectIsForbiddenAsNotOwner() {
    var id = UUID.randomUUID();
    var project = new Project("Theirs", null, START, null, null, UUID.randomUUID());
    when(repository.findById(id)).thenReturn(Optional.of(project));

    assertThatThrownBy(() -> service.getProject(USER, id))
        .isInstanceOf(ForbiddenException.class)
        .hasFieldOrPropertyWithValue("reason", "not_owner");
  }

  @Test
  void getProject_missingProjectIsNotFound() {
    var id = UUID.randomUUID();
    when(repository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getProject(USER, id))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void getProject_madminReadsAnyProjectWithCreatorName() {
    var id = UUID.randomUUID();
    var project = new Project("Theirs", null, START, null, null, USER_ID);
    when(repository.findById(id)).thenReturn(Optional.of(project));
    when(repository.findUserName(USER_ID)).thenReturn(Optional.of("Alice"));

    var view = service.getProject(MADMIN, id);

    assertThat(view.project().getName()).isEqualTo("Theirs");
    assertThat(view.creatorName()).isEqualTo("Alice");
  }

  @Test
  void createProject_recordsCallerAsCreatorWithPendingDefault() {
    when(repository.save(any(Project.class))).thenAnswer(i -> i.getArgument(0));

    var view =
        service.createProject(
            USER, new ProjectService.NewProject("New", "Desc", START, null, null));

    assertThat(view.project().getCreatedBy()).isEqualTo(USER_ID);
    assertThat(view.project().getStatus()).isEqualTo(ProjectStatus.PENDING);
  }

  @Test
  void createProject_endDateBeforeStartIsRejectedBeforeSaving() {
    var request =
        new ProjectService.NewProject(
            "New", null, START, START.minusDays(1), ProjectStatus.COMPLETED);

    assertThatThrownBy(() -> service.createProject(MADMIN, request))
        .isInstanceOf(ValidationException.class)
        .hasFieldOrPropertyWithValue("constraint", "date_order");
    verify(repository, never()).save(any());
  }

  @Test
  void updateProject_rejectedUpdateLeavesProjectUnchanged() {
    var id = UUID.randomUUID();
    var project = new Project("Mine", null, START, null, ProjectStatus.ONGOING, USER_ID);
    when(repository.findById(id)).thenReturn(Optional.of(project));

    var changes =
        new ProjectService.ProjectChanges("Renamed", null, null, START.plusDays(5), null);

    assertThatThrownBy(() -> service.updateProject(USER, id, changes))
        .isInstanceOf(ValidationException.class)
        .hasFieldOrPropertyWithValue("constraint", "end_date_requires_completed");
    assertThat(project.getName()).isEqualTo("Mine");
    assertThat(project.getEndDate()).isNull();
    verify(repository, never()).save(any());
  }

  @Test
  void updateProject_userMaySetEndDateWhenCompletingInSameWrite() {
    var id = UUID.randomUUID();
    var project = new Project("Mine", null, START, null, ProjectStatus.ONGOING, USER_ID);
    when(repository.findById(id)).thenReturn(Optional.of(project));
    when(repository.save(project)).thenReturn(project);

    var view =
        service.updateProject(
            USER,
            id,
            new ProjectService.ProjectChanges(
                null, null, null, START.plusDays(5), ProjectStatus.COMPLETED));

    assertThat(view.project().getStatus()).isEqualTo(ProjectStatus.COMPLETED);
    assertThat(view.project().getEndDate()).isEqualTo(START.plusDays(5));
  }

  @Test
  void completeProject_setsTodayAsEndDate() {
    var id = UUID.randomUUID();
    var project = new Project("Mine", null, START, null, ProjectStatus.ONGOING, USER_ID);
    when(repository.findById(id)).thenReturn(Optional.of(project));
    when(repository.save(project)).thenReturn(project);

    var view = service.completeProject(USER, id);

    assertThat(view.project().getStatus()).isEqualTo(ProjectStatus.COMPLETED);
    assertThat(view.project().getEndDate()).isEqualTo(LocalDate.now());
  }

  @Test
  void deleteProject_madminIsDenied() {
    assertThatThrownBy(() -> service.deleteProject(MADMIN, UUID.randomUUID()))
        .isInstanceOf(ForbiddenException.class);
    verify(repository, never()).delete(any());
  }

  @Test
  void getStats_userSeesOwnCountsOnly() {
    when(repository.countByStatusForCreator(USER_ID)).thenReturn(null);

    var stats = service.getStats(USER);

    assertThat(stats).isEqualTo(ProjectStats.EMPTY);
    verify(repository, never()).countByStatus();
  }
}
