package ca.gc.cra.warper.domain.warp;

import java.util.List;
import java.util.Objects;

/**
 * One configured option of the external reprojection tool.
 *
 * <p>Options are rendered on the command line as a single-dash flag named after the configuration
 * key. A {@link Repeated} option emits {@code -name value} once per value; a {@link Tokens} option
 * emits {@code -name} followed by the whitespace-separated tokens of its text.</p>
 *
 * @since WARPER 0.1
 */
public sealed interface ToolOption permits ToolOption.Repeated, ToolOption.Tokens {

  /**
   * Returns the option name without the leading dash.
   *
   * @return option name
   */
  String name();

  /**
   * Returns the command-line arguments contributed by this option, in order.
   *
   * @return flag and value tokens
   */
  List<String> toArguments();

  /**
   * Creates an option that repeats its flag for every value.
   *
   * @param name option name without dash
   * @param values ordered values
   * @return repeated option
   */
  static ToolOption repeated(String name, List<String> values) {
    return new Repeated(name, values);
  }

  /**
   * Creates an option whose text is split into whitespace-separated tokens after the flag.
   *
   * @param name option name without dash
   * @param text raw option text
   * @return token option
   */
  static ToolOption tokens(String name, String text) {
    return new Tokens(name, text);
  }

  /**
   * List-valued option; the flag is repeated once per element.
   *
   * @param name option name without dash
   * @param values ordered values; copied
   */
  record Repeated(String name, List<String> values) implements ToolOption {
    public Repeated {
      name = requireName(name);
      values = List.copyOf(Objects.requireNonNull(values, "values"));
    }

    @Override
    public List<String> toArguments() {
      String flag = "-" + name;
      String[] args = new String[values.size() * 2];
      int i = 0;
      for (String value : values) {
        args[i++] = flag;
        args[i++] = value;
      }
      return List.of(args);
    }
  }

  /**
   * String-valued option; the text is tokenized on whitespace and appended once after the flag.
   *
   * @param name option name without dash
   * @param text raw text, e.g. {@code "0.01 0.01"}
   */
  record Tokens(String name, String text) implements ToolOption {
    public Tokens {
      name = requireName(name);
      text = Objects.requireNonNull(text, "text");
    }

    @Override
    public List<String> toArguments() {
      String trimmed = text.trim();
      if (trimmed.isEmpty()) {
        return List.of("-" + name);
      }
      String[] tokens = trimmed.split("\\s+");
      String[] args = new String[tokens.length + 1];
      args[0] = "-" + name;
      System.arraycopy(tokens, 0, args, 1, tokens.length);
      return List.of(args);
    }
  }

  private static String requireName(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("option name must not be blank");
    }
    return name;
  }
}
