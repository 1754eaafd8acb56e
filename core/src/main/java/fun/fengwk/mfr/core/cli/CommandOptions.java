package fun.fengwk.mfr.core.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.List;

/**
 * @author fengwk
 */
final class CommandOptions {

    private CommandOptions() {
    }

    static String firstValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

}
