package at.sv.astro;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class AstroPlannerTest {

    private ByteArrayOutputStream out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new StringWriter();
        commandLine = new CommandLine(new AstroPlanner(new PrintStream(out, true, StandardCharsets.UTF_8)));
        commandLine.setErr(new PrintWriter(err));
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void run_printsDailyCalendarAndPolaris() {
        int exitCode = commandLine.execute("--lat=48.2082", "--long=16.3738", "--label=Vienna, AT",
                "--date=2024-06-20", "--month=2024-02");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("Vienna, AT", "2024-06-20", "Sunrise ", "Solar noon ", "Moonrise ",
                "CIVIL_DAWN", "Day length", "Polaris: LST ", "2024-02",
                "48° 12' 29.52\" N");
        assertThat(output()).contains("  29  ").doesNotContain("  30  ");
    }

    @Test
    void run_headlineTimesNotRepeatedInEventList() {
        int exitCode = commandLine.execute("--lat=48.2082", "--long=16.3738", "--label=Vienna, AT",
                "--date=2024-06-20", "--month=2024-06");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("Solar noon ")
                            .doesNotContain("SOLAR_NOON", "SUNRISE", "SUNSET", "MOONRISE", "MOONSET");
    }

    @Test
    void run_referenceEpochIllumination() {
        int exitCode = commandLine.execute("--date=2025-01-29", "--month=2025-01",
                "--calendar-illumination=reference-epoch");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("Prague, CZ");
    }

    @Test
    void invalidLatitude_usageError() {
        int exitCode = commandLine.execute("--lat=91", "--long=14");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--lat must be between -90 and 90 degrees");
    }

    @Test
    void invalidLongitude_usageError() {
        int exitCode = commandLine.execute("--lat=50", "--long=-181");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--long must be between -180 and 180 degrees");
    }

    @Test
    void invalidIlluminationModel_usageError() {
        int exitCode = commandLine.execute("--calendar-illumination=random");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--calendar-illumination");
    }

    @Test
    void invalidDate_usageError() {
        int exitCode = commandLine.execute("--date=20.06.2024");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--date must be formatted as yyyy-MM-dd");
    }
}
