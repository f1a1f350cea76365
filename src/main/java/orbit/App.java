package orbit;

import orbit.cli.OrbitCommand;
import picocli.CommandLine;

/**
 * Command-line entry point.
 */
public class App {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OrbitCommand()).execute(args);
        System.exit(exitCode);
    }
}
