package work.labsim.simulator.support;

import ch.qos.logback.classic.Logger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.LoggerFactory;

public final class LogbackSupport {
    private LogbackSupport() {}

    public static Logger logger(String name) {
        return (Logger) LoggerFactory.getLogger(name);
    }

    public static List<String> appenderNames(Logger logger) {
        var names = new ArrayList<String>();
        logger.iteratorForAppenders().forEachRemaining(appender -> names.add(appender.getName()));
        return names;
    }
}
