package at.sv.sunlight;

import at.sv.sunlight.time.InvalidStartTimeExpression;
import at.sv.sunlight.time.StartTimeProvider;
import at.sv.sunlight.time.StartTimeProviderImpl;
import at.sv.sunlight.time.SunTimesProviderImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "Sunlight", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints sunrise, solar noon, sunset and twilight times for a location and date.")
public final class Sunlight implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(Sunlight.class);
    private static final DateTimeFormatter OUTPUT_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The date to compute the solar times for. Default: today in the given time zone.")
    LocalDate date;
    @Option(names = "--zone", paramLabel = "<zone>",
            defaultValue = "${env:TIME_ZONE}",
            description = "The time zone used for the output, e.g. Europe/Vienna. Default: the system time zone.")
    ZoneId zone;
    @Parameters(paramLabel = "EXPRESSION", arity = "0..*",
            description = "Optional start time expressions to resolve, e.g. 'sunrise', 'civil_dusk-15' or '07:30'. " +
                          "If omitted, all solar times of the day are printed.")
    List<String> expressions;

    public static void main(String[] args) {
        int execute = new CommandLine(new Sunlight()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public Integer call() {
        Coordinates coordinates = parseCoordinates();
        ZoneId outputZone = zone != null ? zone : ZoneId.systemDefault();
        LocalDate day = date != null ? date : LocalDate.now(outputZone);
        ZonedDateTime dateTime = day.atStartOfDay(outputZone);
        LOG.info("Using location {} on {} ({})", coordinates, day, outputZone);

        StartTimeProvider startTimeProvider = new StartTimeProviderImpl(new SunTimesProviderImpl(coordinates));
        PrintWriter out = spec.commandLine().getOut();
        if (expressions == null || expressions.isEmpty()) {
            out.println(startTimeProvider.toDebugString(dateTime));
            out.flush();
            return 0;
        }
        for (String expression : expressions) {
            try {
                Optional<ZonedDateTime> start = startTimeProvider.getStart(expression, dateTime);
                out.println(expression + ": " + start.map(OUTPUT_FORMATTER::format).orElse("does not occur"));
            } catch (InvalidStartTimeExpression e) {
                LOG.error("{}", e.getMessage());
                out.flush();
                return 1;
            }
        }
        out.flush();
        return 0;
    }

    private Coordinates parseCoordinates() {
        try {
            return Coordinates.of(latitude, longitude);
        } catch (InvalidCoordinates e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }
}
