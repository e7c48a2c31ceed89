package cafe.woden.multisplit;

import cafe.woden.multisplit.config.MultiSplitProperties;
import cafe.woden.multisplit.geometry.GeometryCalculator;
import cafe.woden.multisplit.model.PaneIdGenerator;
import cafe.woden.multisplit.persist.LayoutJsonCodec;
import cafe.woden.multisplit.reconcile.TreeReconciler;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Objects;

/** Creates independent {@link PaneLayout}s sharing one configuration. */
public class PaneLayoutFactory {

  private final MultiSplitProperties props;
  private final GeometryCalculator calculator;
  private final TreeReconciler reconciler;
  private final LayoutJsonCodec codec;

  public PaneLayoutFactory(
      MultiSplitProperties props,
      GeometryCalculator calculator,
      TreeReconciler reconciler,
      LayoutJsonCodec codec) {
    this.props = Objects.requireNonNull(props, "props");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /** Factory with default settings and no Spring context. */
  public static PaneLayoutFactory standalone() {
    MultiSplitProperties props = MultiSplitProperties.defaults();
    return new PaneLayoutFactory(
        props,
        new GeometryCalculator(MultiSplitConfiguration.geometryOptions(props)),
        new TreeReconciler(),
        new LayoutJsonCodec(new ObjectMapper(), MultiSplitConfiguration.defaultConstraints(props)));
  }

  public MultiSplitProperties properties() {
    return props;
  }

  public PaneLayout create() {
    return create(PaneIdGenerator.sequential(props.paneIdPrefix()), Clock.systemUTC());
  }

  public PaneLayout create(PaneIdGenerator ids, Clock clock) {
    return new PaneLayout(props, ids, clock, calculator, reconciler, codec);
  }
}
