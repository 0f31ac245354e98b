package eventlog.projection;

import eventlog.InMemoryEventLogStore;
import eventlog.InMemoryPositionStore;
import eventlog.StubConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionManagerTest {

  private final StubConnection connections = new StubConnection();
  private final InMemoryEventLogStore eventStore = new InMemoryEventLogStore();
  private final InMemoryPositionStore positionStore = new InMemoryPositionStore();
  private final ProjectionManager manager = new ProjectionManager();

  @AfterEach
  void tearDown() {
    manager.close();
  }

  private ProjectionRunner runner(Projector projector) {
    return ProjectionRunner.builder()
        .orchestrator(ProjectionOrchestrator.builder()
            .connectionProvider(connections.provider())
            .eventLogStore(eventStore)
            .positionStore(positionStore)
            .projector(projector)
            .config(ProjectionConfig.builder()
                .pollInterval(Duration.ofHours(1))
                .maxRetries(0)
                .build())
            .build())
        .build();
  }

  @Test
  void registersAndListsByName() {
    manager.register(runner(new RecordingProjector("b")))
        .register(runner(new RecordingProjector("a")));

    assertEquals(List.of("a", "b"), manager.names());
  }

  @Test
  void rejectsDuplicateNames() {
    manager.register(runner(new RecordingProjector("a")));

    assertThrows(IllegalArgumentException.class, () -> manager.register(runner(new RecordingProjector("a"))));
  }

  @Test
  void unknownNameIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> manager.start("missing"));
    assertTrue(ex.getMessage().contains("missing"));
  }

  @Test
  void startStopAndStatusByName() {
    eventStore.seed("x", 2);
    manager.register(runner(new RecordingProjector("a")));

    manager.start("a");
    assertEquals(ProjectionState.RUNNING, manager.status("a").state());
    assertEquals(2L, manager.status("a").eventsProcessed());

    manager.stop("a");
    assertEquals(ProjectionState.STOPPED, manager.status("a").state());
  }

  @Test
  void rebuildAndHealthByName() {
    eventStore.seed("x", 3);
    RecordingProjector projector = new RecordingProjector("a");
    manager.register(runner(projector));

    RebuildResult result = manager.rebuild("a");

    assertTrue(result.success());
    assertEquals(3, result.eventsProcessed());
    assertTrue(manager.health("a").healthy());
    assertEquals(0, manager.health("a").lag());
  }

  @Test
  void startAllStartsHealthyRunnersDespiteOneFailure() {
    eventStore.seed("x", 1);
    RecordingProjector failing = new RecordingProjector("failing");
    failing.failOn(1, Integer.MAX_VALUE);
    manager.register(runner(failing)).register(runner(new RecordingProjector("ok")));

    assertThrows(ProjectionApplyException.class, manager::startAll);

    assertEquals(ProjectionState.ERROR, manager.status("failing").state());
    assertEquals(ProjectionState.RUNNING, manager.status("ok").state());
    assertEquals(2, manager.statuses().size());
  }

  @Test
  void closeStopsEveryRunner() {
    manager.register(runner(new RecordingProjector("a")));
    manager.startAll();

    manager.close();

    assertFalse(manager.runner("a").isRunning());
    assertThrows(IllegalStateException.class, () -> manager.start("a"));
  }
}
