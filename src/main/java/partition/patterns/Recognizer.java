package partition.patterns;

import java.util.List;
import partition.model.Layer;
import partition.model.Model;

/**
 * Structural pattern looked up in a model before partitioning.
 *
 * <p>Recognizers are pure: they only read the model and report which sets of
 * layers match. Attaching labels to the matched layers is up to the caller.
 */
public interface Recognizer {

  /**
   * Name under which the pattern is referred to in the configuration.
   */
  public String patternName();

  /**
   * Find every occurrence of the pattern.
   *
   * @param model model to search
   * @return matched layers, one list per occurrence, each in model order
   */
  public List<List<Layer>> match(Model model);
}
