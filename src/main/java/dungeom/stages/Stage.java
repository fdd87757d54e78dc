/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dungeom.stages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

/**
 * An abstract base class for each stage of processing.
 *
 * To create a new stage you should overload the following methods
 *   * createParameterDefinitions(): This function returns a map of parameter
 *      definitions which the stage can take. You should always start by
 *      calling the implementation in the base class and adding the result to
 *      a new Map. Its good practice to return an unmodifiable map
 *      by invoking Collections.unmodifiableMap();
 *
 *   * validateParameters(): Check the values of the parameters.
 *
 *   * stageMain(): The code for the stage.
 *
 * A stage can be run in two ways
 *   1. From the command line: main should invoke run(String[]) which parses
 *      the arguments and then calls execute().
 *   2. From within java: call setParameter for each parameter and then
 *      execute().
 */
public abstract class Stage {
  private static final Logger sLogger = Logger.getLogger(Stage.class);

  /**
   * State of the stage.
   */
  public enum StageState {
    STARTED, SUCCESS, FAILURE
  }

  protected StageState stageState;

  /**
   * A set of key value pairs of options used to configure the stage.
   * These could come from either command line options or the caller.
   */
  protected HashMap<String, Object> stage_options =
      new HashMap<String, Object>();

  /**
   * Definitions of the parameters. Subclasses can access it
   * by calling getParameterDefinitions.
   */
  private Map<String, ParameterDefinition> definitions = null;

  /**
   * A class containing information about invalid parameters.
   */
  public static class InvalidParameter {
    // Name of the invalid parameter.
    final public String name;

    // Message describing why the parameter is invalid.
    final public String message;

    public InvalidParameter(String name, String message) {
      this.name = name;
      this.message = message;
    }
  }

  /**
   * This function creates the set of parameter definitions for this stage.
   * Overload this function in your subclass to set the definitions for the
   * stage.
   */
  protected Map<String, ParameterDefinition> createParameterDefinitions() {
    HashMap<String, ParameterDefinition> parameters =
        new HashMap<String, ParameterDefinition>();

    // Return definitions used by all stages.
    DungeomParameters.addList(parameters, DungeomParameters.getCommon());
    return Collections.unmodifiableMap(parameters);
  }

  /**
   * Return a list of the parameter definitions for this stage.
   */
  final public Map<String, ParameterDefinition> getParameterDefinitions() {
    if (definitions == null) {
      definitions = createParameterDefinitions();
    }
    return definitions;
  }

  /**
   * Returns a list of the required parameters.
   *
   * Parameters with no default value are assumed to be required.
   */
  protected List<String> getRequiredParameters() {
    ArrayList<String> required = new ArrayList<String>();
    for (ParameterDefinition def : getParameterDefinitions().values()) {
      if (def.getDefault() == null) {
        required.add(def.getName());
      }
    }
    Collections.sort(required);
    return required;
  }

  /**
   * Check that the indicated options have been supplied to the stage.
   *
   * @param required: List of required options.
   * @throws IllegalArgumentException listing the missing options.
   */
  protected void checkHasParameters(List<String> required) {
    ArrayList<String> missing = new ArrayList<String>();
    for (String arg_name: required) {
      if (!stage_options.containsKey(arg_name) ||
           stage_options.get(arg_name) == null) {
        missing.add(arg_name);
      }
    }

    if (missing.size() > 0) {
      String message = "Missing required arguments: " +
          StringUtils.join(missing, ",");
      sLogger.error(message);
      throw new IllegalArgumentException(message);
    }
  }

  /**
   * Check whether parameters are valid.
   * Subclasses which override this method should call the base class.
   *
   * We return information describing all the invalid parameters.
   */
  public List<InvalidParameter> validateParameters() {
    ArrayList<InvalidParameter> invalid = new ArrayList<InvalidParameter>();
    for (String key : stage_options.keySet()) {
      if (!getParameterDefinitions().containsKey(key)) {
        invalid.add(new InvalidParameter(
            key, "Stage " + this.getClass().getSimpleName() +
            " doesn't take this parameter."));
      }
    }
    return invalid;
  }

  /**
   * Set the parameter.
   * @param name
   * @param value
   */
  public void setParameter(String name, Object value) {
    stage_options.put(name, value);
  }

  /**
   * Set the parameters for this stage. Any unset parameters will be
   * initialized to the default values if there is one.
   */
  public void setParameters(Map<String, Object> values) {
    stage_options.putAll(values);
    fillDefaults();
  }

  private void fillDefaults() {
    for (ParameterDefinition def : getParameterDefinitions().values()) {
      // If the value hasn't be set and the parameter has a default value
      // initialize it to the default value
      if (!stage_options.containsKey(def.getName())
          && def.getDefault() != null) {
        stage_options.put(def.getName(), def.getDefault());
      }
    }
  }

  /**
   * Process the command line options.
   */
  protected void parseCommandLine(String[] application_args)
      throws ParseException {
    Options options = new Options();
    for (ParameterDefinition def : getParameterDefinitions().values()) {
      options.addOption(def.getOption());
    }
    CommandLineParser parser = new GnuParser();
    CommandLine line = parser.parse(options, application_args);

    HashMap<String, Object> parameters = new HashMap<String, Object>();
    for (ParameterDefinition def : getParameterDefinitions().values()) {
      Object value = def.parseCommandLine(line);
      if (value != null) {
        parameters.put(def.getName(), value);
      }
    }
    setParameters(parameters);
  }

  /**
   * Print the help message.
   */
  protected void printHelp() {
    HelpFormatter formatter = new HelpFormatter();
    Options options = new Options();
    for (ParameterDefinition def : getParameterDefinitions().values()) {
      options.addOption(def.getOption());
    }
    formatter.printHelp(
        "java " + this.getClass().getName() + " [options]", options);
  }

  protected void setupLogging() {
    String logFile = (String) stage_options.get("log_file");

    if (logFile != null && logFile.length() > 0) {
      for (Enumeration<?> e = Logger.getRootLogger().getAllAppenders();
           e.hasMoreElements(); ) {
        Appender appender = (Appender) e.nextElement();
        if (logFile.equals(appender.getName())) {
          // We've already setup the logger to the file so we don't setup
          // another one because that would cause messages to be logged
          // multiple times.
          return;
        }
      }
      FileAppender fileAppender = new FileAppender();
      fileAppender.setFile(logFile);
      PatternLayout layout = new PatternLayout();
      layout.setConversionPattern("%d{ISO8601} %p %c: %m%n");
      fileAppender.setLayout(layout);
      fileAppender.activateOptions();

      // Name the appender based on the file to write to so that we can
      // check whether this appender has already been added.
      fileAppender.setName(logFile);
      Logger.getRootLogger().addAppender(fileAppender);
      sLogger.info("Adding a file log appender to: " + logFile);
    }
  }

  protected void logParameters() {
    ArrayList<String> keys = new ArrayList<String>(stage_options.keySet());
    Collections.sort(keys);
    ArrayList<String> pairs = new ArrayList<String>();
    for (String key : keys) {
      pairs.add(key + "=" + stage_options.get(key));
    }
    sLogger.info(this.getClass().getSimpleName() + " parameters: " +
                 StringUtils.join(pairs, ", "));
  }

  /**
   * Code for the stage goes here.
   *
   * @return True on success false otherwise.
   */
  abstract protected boolean stageMain();

  public StageState getStageState() {
    return stageState;
  }

  /**
   * Execute the stage.
   *
   * @return True on success false otherwise.
   * @throws IllegalArgumentException if parameters are missing or invalid.
   */
  final public boolean execute() {
    fillDefaults();
    setupLogging();
    checkHasParameters(getRequiredParameters());
    List<InvalidParameter> invalidParameters = validateParameters();

    stageState = StageState.STARTED;
    if (invalidParameters.size() > 0) {
      for (InvalidParameter parameter : invalidParameters) {
        sLogger.fatal(
            String.format(
                "Parameter: %s isn't valid: %s",
                parameter.name, parameter.message));
      }
      stageState = StageState.FAILURE;
      throw new IllegalArgumentException("Parameters are invalid.");
    }

    logParameters();
    boolean success = stageMain();
    stageState = success ? StageState.SUCCESS : StageState.FAILURE;
    return success;
  }

  /**
   * Run the stage after parsing the string arguments.
   *
   * Malformed values and parameters which fail validation are reported
   * through the log and the exit code rather than an exception.
   *
   * @return 0 on success and -1 otherwise.
   */
  final public int run(String[] args) throws Exception {
    sLogger.info("Tool name: " + this.getClass().getName());

    // Print the command line on a single line as its convenient for
    // copy pasting.
    sLogger.info("Command line arguments: " + StringUtils.join(args, " "));

    try {
      parseCommandLine(args);
    } catch (ParseException exp) {
      sLogger.error("Parsing failed.  Reason: " + exp.getMessage());
      printHelp();
      return -1;
    } catch (NumberFormatException exp) {
      sLogger.error("Parsing failed.  Reason: " + exp.getMessage());
      printHelp();
      return -1;
    }

    if ((Boolean) stage_options.get("help")) {
      printHelp();
      return 0;
    }
    try {
      return execute() ? 0 : -1;
    } catch (IllegalArgumentException exp) {
      // Invalid or missing parameters; the details were already logged.
      sLogger.error("Stage failed.  Reason: " + exp.getMessage());
      return -1;
    }
  }
}
