package io.b2mash.pms.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.pms.exception.ResourceConflictException;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ProjectTest {

  private static final LocalDate START = LocalDate.of(2024, 1, 10);

  private Project newProject() {
    return new Project("Website", "Relaunch", START, null, null, UUID.randomUUID());
  }

  @Test
  void newProjectDefaultsToPending() {
    assertThat(newProject().getStatus()).isEqualTo(ProjectStatus.PENDING);
  }

  @Test
  void completeSetsStatusAndEndDate() {
    var project = newProject();
    var today = LocalDate.of(2024, 2, 1);

    project.complete(today);

    assertThat(project.getStatus()).isEqualTo(ProjectStatus.COMPLETED);
    assertThat(project.getEndDate()).isEqualTo(today);
  }

  @Test
  void completeTwiceIsAConflict() {
    var project = newProject();
    project.complete(LocalDate.of(2024, 2, 1));

    assertThatThrownBy(() -> project.complete(LocalDate.of(2024, 2, 2)))
        .isInstanceOf(ResourceConflictException.class)
        .hasFieldOrPropertyWithValue("condition", "already_completed");
    assertThat(project.getEndDate()).isEqualTo(LocalDate.of(2024, 2, 1));
  }

  @Test
  void updateIgnoresNullFields() {
    var project = newProject();

    project.update("Renamed", null, null, null, ProjectStatus.ONGOING);

    assertThat(project.getName()).isEqualTo("Renamed");
    assertThat(project.getDescription()).isEqualTo("Relaunch");
    assertThat(project.getStartDate()).isEqualTo(START);
    assertThat(project.getStatus()).isEqualTo(ProjectStatus.ONGOING);
  }
}
