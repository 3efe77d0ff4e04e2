package ca.gc.cra.tide.testutil;

import ca.gc.cra.tide.application.port.ReplicationSource;
import ca.gc.cra.tide.domain.replication.Lsn;
import ca.gc.cra.tide.domain.replication.ReplicationFrame;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Replication source replaying a fixed script of frames, idle polls and side effects.
 */
public final class ScriptedReplicationSource implements ReplicationSource {
  private final Deque<Step> script = new ArrayDeque<>();
  private final List<Lsn> acknowledged = Collections.synchronizedList(new ArrayList<>());
  private volatile boolean started;
  private volatile boolean closed;
  private volatile boolean exhausted;
  private Exception closeFailure;

  public ScriptedReplicationSource frame(long lsn, byte[] payload) {
    script.add(new Step(new ReplicationFrame(Lsn.of(lsn), payload), null));
    return this;
  }

  public ScriptedReplicationSource idle() {
    script.add(new Step(null, null));
    return this;
  }

  public ScriptedReplicationSource then(Runnable action) {
    script.add(new Step(null, action));
    return this;
  }

  public ScriptedReplicationSource failCloseWith(Exception failure) {
    this.closeFailure = failure;
    return this;
  }

  @Override
  public void start() {
    started = true;
  }

  @Override
  public Optional<ReplicationFrame> receive() {
    while (true) {
      Step step = script.poll();
      if (step == null) {
        exhausted = true;
        return Optional.empty();
      }
      if (step.action() != null) {
        step.action().run();
        continue;
      }
      return Optional.ofNullable(step.frame());
    }
  }

  @Override
  public void acknowledge(Lsn position) {
    acknowledged.add(position);
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public void close() throws Exception {
    closed = true;
    if (closeFailure != null) {
      throw closeFailure;
    }
  }

  public boolean started() {
    return started;
  }

  public boolean closed() {
    return closed;
  }

  public List<Lsn> acknowledged() {
    return List.copyOf(acknowledged);
  }

  public int remaining() {
    return script.size();
  }

  private record Step(ReplicationFrame frame, Runnable action) {}
}
