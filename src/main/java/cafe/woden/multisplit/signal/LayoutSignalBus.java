package cafe.woden.multisplit.signal;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.Objects;

/**
 * Synchronous fan-out of {@link LayoutSignal}s for one pane tree.
 *
 * <p>Subscribers run on the publishing thread before {@link #publish} returns. A subscriber must
 * not mutate the tree while a signal from an in-progress mutation is being delivered.
 */
public final class LayoutSignalBus {

  private final FlowableProcessor<LayoutSignal> signals =
      PublishProcessor.<LayoutSignal>create().toSerialized();

  public Flowable<LayoutSignal> signals() {
    return signals.onBackpressureBuffer();
  }

  public <T extends LayoutSignal> Flowable<T> signals(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return signals().ofType(type);
  }

  public void publish(LayoutSignal signal) {
    signals.onNext(Objects.requireNonNull(signal, "signal"));
  }

  public boolean hasSubscribers() {
    return signals.hasSubscribers();
  }
}
