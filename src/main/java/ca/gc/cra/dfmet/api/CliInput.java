package ca.gc.cra.dfmet.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line tokens of one DFMET invocation, split into recognised switches, {@code key=value} settings and
 * anything that looked like a switch but is not one.
 *
 * <p>Switches are matched case-insensitively. A token that starts with {@code -} and carries no {@code =} is either a
 * known {@link Flag} alias or lands in {@link #unknownFlags()}, so a typo such as {@code --dryrun} can be reported
 * instead of silently converting for real.
 *
 * @param keyValueArgs tokens destined for {@link CliArgsParser}
 * @param flags recognised switches
 * @param unknownFlags switch-like tokens that match no alias, as typed
 * @since 0.1.0
 */
public record CliInput(List<String> keyValueArgs, Set<Flag> flags, List<String> unknownFlags) {

  /** Switches understood by the dispatcher and the convert command. */
  public enum Flag {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run"),
    ALLOW_OVERWRITE("--allow-overwrite");

    private final List<String> aliases;

    Flag(String... aliases) {
      this.aliases = List.of(aliases);
    }

    static Flag fromToken(String lowerCaseToken) {
      for (Flag flag : values()) {
        if (flag.aliases.contains(lowerCaseToken)) {
          return flag;
        }
      }
      return null;
    }
  }

  /** Copies the parts so the record stays immutable. */
  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = flags.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    unknownFlags = List.copyOf(unknownFlags);
  }

  /**
   * Splits raw arguments. {@code null} and blank tokens are dropped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed tokens
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<Flag> flags = EnumSet.noneOf(Flag.class);
    List<String> unknown = new ArrayList<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        Flag flag = Flag.fromToken(arg.toLowerCase(Locale.ROOT));
        if (flag != null) {
          flags.add(flag);
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          unknown.add(arg);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags, unknown);
  }

  /**
   * Returns whether a switch was given.
   *
   * @param flag switch to query
   * @return {@code true} when present
   */
  public boolean has(Flag flag) {
    return flags.contains(flag);
  }

  /** @return {@code true} when help output was requested */
  public boolean help() {
    return has(Flag.HELP);
  }

  /** @return {@code true} when DEBUG logging was requested */
  public boolean verbose() {
    return has(Flag.VERBOSE);
  }

  /** @return key/value tokens as an array for {@link CliArgsParser#toMap(String[])} */
  public String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }
}
