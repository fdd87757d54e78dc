package dungeom.stages;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;

/**
 * Definition of a stage parameter.
 *
 * For each parameter we define an instance of this class. The instance
 * doesn't store the value of the parameter; it knows how to describe the
 * parameter on the command line and how to convert a string into a value of
 * the right type.
 */
public class ParameterDefinition {
  protected String name_;
  protected String description_;
  protected Class<?> type_;
  protected Object default_value_;

  protected String short_name_;
  /**
   * Construct the parameter.
   * @param name: Name for the parameter.
   * @param description: Description for the parameter.
   * @param type: The type for the parameter.
   * @param default_value: Default value for the parameter.
   *   Set this to null if there is no default value.
   */
  public ParameterDefinition (
      String name, String description, Class<?> type, Object default_value) {
   this.name_ = name;
   this.description_ = description;
   this.type_ = type;
   this.default_value_ = default_value;
   this.short_name_ = name;
  }

  public Option getOption() {
    String description = description_;
    if (default_value_ != null) {
      description = description + " (default: " + default_value_.toString() +
          ")";
    }
    if (type_.equals(Boolean.class)) {
      // Boolean arguments may be given without a value, e.g. --help.
      Option option = new Option(short_name_, name_, true, description);
      option.setOptionalArg(true);
      return option;
    } else {
      return new Option(short_name_, name_, true, description);
    }
  }

  public String getName() {
    return name_;
  }

  /**
   * A short name for the parameter.
   * @param short_name
   */
  public void setShortName(String short_name) {
    short_name_ = short_name;
  }

  /**
   * Parse out the value of the parameter from the command line.
   * Returns null if the parameter isn't on the command line.
   * @param line
   */
  public Object parseCommandLine(CommandLine line) {
    String value = null;
    if (line.hasOption(name_)) {
      value = line.getOptionValue(name_);
    } else if (line.hasOption(short_name_)) {
     value = line.getOptionValue(short_name_);
    } else {
      return null;
    }
    if (value == null && type_.equals(Boolean.class)) {
      // A flag without a value turns the option on.
      return Boolean.TRUE;
    }
    return fromString(value);
  }

  public Object getDefault() {
    // The allowed types are immutable so we don't have to worry about
    // the caller being able to change the value.
    return default_value_;
  }

  /**
   * Convert a string representation of this parameter to an instance of
   * the appropriate type.
   * @param value
   */
  protected Object fromString(String value) {
    if (type_.equals(String.class)) {
      return value;
    } else if (type_.equals(Long.class)) {
      return Long.parseLong(value);
    } else if (type_.equals(Boolean.class)) {
      return Boolean.parseBoolean(value);
    } else if (type_.equals(Integer.class)) {
      return Integer.parseInt(value);
    } else if (type_.equals(Float.class)) {
      return Float.parseFloat(value);
    } else {
      throw new RuntimeException("No handler for this type of parameter");
    }
  }
}
