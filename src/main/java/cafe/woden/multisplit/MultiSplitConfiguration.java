package cafe.woden.multisplit;

import cafe.woden.multisplit.config.MultiSplitProperties;
import cafe.woden.multisplit.geometry.GeometryCalculator;
import cafe.woden.multisplit.geometry.GeometryOptions;
import cafe.woden.multisplit.model.SizeConstraints;
import cafe.woden.multisplit.persist.LayoutJsonCodec;
import cafe.woden.multisplit.reconcile.TreeReconciler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the layout engine. The shared pieces are stateless; every window asks
 * {@link PaneLayoutFactory} for its own {@link PaneLayout}.
 */
@Configuration
@EnableConfigurationProperties(MultiSplitProperties.class)
public class MultiSplitConfiguration {

  @Bean
  GeometryCalculator multiSplitGeometryCalculator(MultiSplitProperties props) {
    return new GeometryCalculator(geometryOptions(props));
  }

  @Bean
  TreeReconciler multiSplitTreeReconciler() {
    return new TreeReconciler();
  }

  @Bean
  LayoutJsonCodec multiSplitLayoutJsonCodec(
      MultiSplitProperties props, ObjectProvider<ObjectMapper> mapper) {
    return new LayoutJsonCodec(mapper.getIfAvailable(ObjectMapper::new), defaultConstraints(props));
  }

  @Bean
  PaneLayoutFactory paneLayoutFactory(
      MultiSplitProperties props,
      GeometryCalculator calculator,
      TreeReconciler reconciler,
      LayoutJsonCodec codec) {
    return new PaneLayoutFactory(props, calculator, reconciler, codec);
  }

  static GeometryOptions geometryOptions(MultiSplitProperties props) {
    return new GeometryOptions(props.geometry().dividerWidth(), SizeConstraints.NONE);
  }

  static SizeConstraints defaultConstraints(MultiSplitProperties props) {
    return new SizeConstraints(props.geometry().minPaneWidth(), props.geometry().minPaneHeight());
  }
}
