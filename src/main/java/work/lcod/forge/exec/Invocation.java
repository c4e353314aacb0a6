package work.lcod.forge.exec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import work.lcod.forge.settings.Secret;

/**
 * Command line of a backend tool. Arguments may be {@link Secret}s: they are revealed only by
 * {@link #command()} and print as {@value Secret#MASK} everywhere else.
 */
public final class Invocation {
    private final List<Object> arguments;

    private Invocation(List<Object> arguments) {
        this.arguments = List.copyOf(arguments);
    }

    public static Invocation of(String program, String... args) {
        return builder(program).args(args).build();
    }

    public static Builder builder(String program) {
        if (program == null || program.isBlank()) {
            throw new IllegalArgumentException("program is required");
        }
        return new Builder(program);
    }

    public String program() {
        return (String) arguments.get(0);
    }

    /**
     * The arguments as handed to the operating system, secrets included.
     */
    public List<String> command() {
        var command = new ArrayList<String>(arguments.size());
        for (var arg : arguments) {
            command.add(arg instanceof Secret secret ? secret.reveal() : (String) arg);
        }
        return command;
    }

    /**
     * Printable arguments with secrets masked.
     */
    public List<String> masked() {
        return arguments.stream()
            .map(arg -> arg instanceof Secret ? Secret.MASK : (String) arg)
            .collect(Collectors.toList());
    }

    public boolean hasSecrets() {
        return arguments.stream().anyMatch(Secret.class::isInstance);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        return other instanceof Invocation that && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return arguments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", masked());
    }

    public static final class Builder {
        private final List<Object> arguments = new ArrayList<>();

        private Builder(String program) {
            arguments.add(program);
        }

        public Builder arg(String arg) {
            arguments.add(Objects.requireNonNull(arg, "arg"));
            return this;
        }

        public Builder args(String... args) {
            for (var arg : args) {
                arg(arg);
            }
            return this;
        }

        public Builder args(Collection<String> args) {
            args.forEach(this::arg);
            return this;
        }

        public Builder argIf(boolean condition, String... args) {
            return condition ? args(args) : this;
        }

        public Builder option(String name, String value) {
            return value == null ? this : arg(name).arg(value);
        }

        public Builder secret(Secret secret) {
            arguments.add(Objects.requireNonNull(secret, "secret"));
            return this;
        }

        public Invocation build() {
            return new Invocation(arguments);
        }
    }
}
