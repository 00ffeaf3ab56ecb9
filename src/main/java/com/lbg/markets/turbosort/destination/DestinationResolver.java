package com.lbg.markets.turbosort.destination;

import com.lbg.markets.turbosort.config.TurbosortConfig;
import com.lbg.markets.turbosort.domain.MarkerDirective;
import com.lbg.markets.turbosort.domain.ResolvedTarget;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a marker destination into the directory files are copied to.
 * Layout: {@code root[/year]/destination[/suffix]}.
 * Resolution does no I/O; creating the directory is up to the caller.
 */
@ApplicationScoped
public class DestinationResolver {

    private static final Logger LOG = Logger.getLogger(DestinationResolver.class);

    private static final Pattern YEAR = Pattern.compile("(19\\d{2}|20\\d{2})");

    private final Path root;
    private final boolean yearPrefix;
    private final String driveSuffix;

    @Inject
    public DestinationResolver(TurbosortConfig config) {
        this.root = Paths.get(config.destination().root()).toAbsolutePath().normalize();
        this.yearPrefix = config.destination().yearPrefix();
        TurbosortConfig.DriveSuffix suffix = config.destination().driveSuffix();
        this.driveSuffix = suffix.enabled() && !suffix.segment().isBlank() ? suffix.segment().trim() : null;
    }

    public Path root() {
        return root;
    }

    public ResolvedTarget resolve(MarkerDirective directive) {
        return resolve(directive.destination());
    }

    /**
     * @throws InvalidDestinationException if the destination is empty, malformed,
     *                                     or would land outside the destination root
     */
    public ResolvedTarget resolve(String markerDestination) {
        Path destination = normalize(markerDestination);

        Path base = root;
        String year = null;
        if (yearPrefix) {
            Optional<String> extracted = extractYear(destination.toString());
            if (extracted.isPresent()) {
                year = extracted.get();
                base = base.resolve(year);
                LOG.debugf("Using year prefix %s for %s", year, destination);
            } else {
                LOG.warnf("No valid year found in path: %s, using standard path", destination);
            }
        }

        Path target = base.resolve(destination);
        if (driveSuffix != null) {
            target = target.resolve(driveSuffix);
        }
        target = target.normalize();

        if (!target.startsWith(root) || target.equals(root)) {
            throw new InvalidDestinationException("Destination escapes " + root + ": " + markerDestination);
        }
        return new ResolvedTarget(target, year);
    }

    /**
     * Finds the leftmost 19xx or 20xx run in the given string.
     */
    public static Optional<String> extractYear(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = YEAR.matcher(path);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private Path normalize(String markerDestination) {
        if (markerDestination == null) {
            throw new InvalidDestinationException("Destination is missing");
        }
        // A leading separator is redundant for a subpath of the destination root
        String relative = markerDestination.trim().replaceFirst("^[/\\\\]+", "");

        Path destination;
        try {
            destination = Paths.get(relative).normalize();
        } catch (InvalidPathException e) {
            throw new InvalidDestinationException("Invalid destination: " + markerDestination, e);
        }

        if (destination.isAbsolute() || destination.getRoot() != null) {
            throw new InvalidDestinationException("Destination must be relative: " + markerDestination);
        }
        String text = destination.toString();
        if (text.isEmpty() || text.equals("..") || text.startsWith(".." + destination.getFileSystem().getSeparator())) {
            throw new InvalidDestinationException("Destination escapes " + root + ": " + markerDestination);
        }
        return destination;
    }
}
