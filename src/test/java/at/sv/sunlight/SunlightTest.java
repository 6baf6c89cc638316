package at.sv.sunlight;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class SunlightTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    private int execute(String... args) {
        return commandLine.execute(args);
    }

    private static String[] raleigh(String... additionalArgs) {
        String[] base = {"--lat", "35.78333333333333", "--long", "-78.65", "--date", "2015-07-12",
                "--zone", "America/New_York"};
        String[] args = new String[base.length + additionalArgs.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(additionalArgs, 0, args, base.length, additionalArgs.length);
        return args;
    }

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new Sunlight());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void noExpressions_printsAllSolarTimes() {
        int exitCode = execute(raleigh());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("sunrise: 06:07:5", "noon: 13:20:1", "sunset: 20:32:1",
                "civil_dawn: 05:38:2", "astronomical_dusk: ");
    }

    @Test
    void expressions_resolvedInGivenZone() {
        int exitCode = execute(raleigh("sunrise", "sunset+30", "07:15"));

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("sunrise: 2015-07-12 06:07:5")
                                  .contains("sunset+30: 2015-07-12 21:02:1")
                                  .contains("07:15: 2015-07-12 07:15:00");
    }

    @Test
    void expressionForMissingEvent_printsDoesNotOccur() {
        int exitCode = execute("--lat", "78.6", "--long", "15.9", "--date", "2021-06-21", "--zone", "Europe/Oslo",
                "sunset");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("sunset: does not occur");
    }

    @Test
    void invalidExpression_exitCodeOne() {
        int exitCode = execute(raleigh("sunrize"));

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void latitudeOutOfRange_parameterError() {
        int exitCode = execute("--lat", "91", "--long", "0", "--date", "2015-07-12");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("latitude");
    }

    @Test
    void missingLongitude_parameterError() {
        int exitCode = execute("--lat", "48.2", "--date", "2015-07-12");

        assertThat(exitCode).isEqualTo(2);
    }
}
