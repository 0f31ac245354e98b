package eventlog.spring.boot;

import eventlog.model.DomainEvent;
import eventlog.projection.Projector;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts distinct events by global sequence.
 */
class CountingProjector implements Projector {
  final Set<Long> seen = ConcurrentHashMap.newKeySet();

  @Override
  public String name() {
    return "counting";
  }

  @Override
  public void apply(DomainEvent event) {
    seen.add(event.globalSequence());
  }

  @Override
  public void reset() {
    seen.clear();
  }
}
