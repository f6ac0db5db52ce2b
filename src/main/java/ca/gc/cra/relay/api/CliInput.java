package ca.gc.cra.relay.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into flags ({@code --dry-run}) and {@code key=value} settings.
 * <p>Help and verbose flags have short aliases and are normalized to {@code --help} and {@code --verbose}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments. Blank and {@code null} entries are skipped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv, flags);
  }

  /** Returns the non-flag arguments in their original order. */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns flags other than the ones listed, e.g. to reject unknown flags.
   *
   * @param known recognised flags in normalized form
   * @return unrecognised flags in input order
   */
  public List<String> unknownFlags(Set<String> known) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!known.contains(flag) && !flag.equals("--help") && !flag.equals("--verbose")) {
        unknown.add(flag);
      }
    }
    return unknown;
  }

  @Override
  public String toString() {
    return "CliInput{flags=" + flags + ", args=" + Arrays.toString(keyValueArgs()) + '}';
  }
}
