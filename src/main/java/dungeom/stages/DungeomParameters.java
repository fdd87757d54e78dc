package dungeom.stages;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/* This class encapsulates the common parameter definitions.
 *
 * If a parameter is used by more than 1 stage its definition should go
 * here. Otherwise its definition should go in the stage where it is used.
 */
public class DungeomParameters {
  private static List<ParameterDefinition> stage_options;

  /**
   * A list of options that apply to all stages.
   */
  public static synchronized List<ParameterDefinition> getCommon() {
    if (stage_options != null) {
      return stage_options;
    }
    stage_options = new ArrayList<ParameterDefinition>();

    ParameterDefinition help = new ParameterDefinition(
        "help", "Print this help message.", Boolean.class, false);
    help.setShortName("h");
    stage_options.add(help);

    ParameterDefinition logFile = new ParameterDefinition(
        "log_file", "File to write the log messages to in addition to the " +
        "console.", String.class, "");
    stage_options.add(logFile);
    return stage_options;
  }

  /**
   * Definition of the kmer length.
   */
  public static ParameterDefinition getK() {
    return new ParameterDefinition(
        "K", "Length of KMers [required].", Integer.class, null);
  }

  /**
   * Add a list of parameters to a map of parameters.
   * @param map
   * @param parameters
   */
  public static void addList(
      Map<String, ParameterDefinition> map,
      List<ParameterDefinition> parameters) {
    for (ParameterDefinition param: parameters) {
      map.put(param.getName(), param);
    }
  }
}
