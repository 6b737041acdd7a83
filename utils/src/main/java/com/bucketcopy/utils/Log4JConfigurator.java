package com.bucketcopy.utils;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

/**
 * Programmatic log4j setup for tools and unit tests. The request context
 * the copier places in the MDC is printed with every line.
 */
public class Log4JConfigurator
{
    // %X{requestContext} prints ObjectCopier.REQUEST_CONTEXT_MDC_KEY:
    public static final String LOGGING_LAYOUT =
        "%d{yyyy-MM-dd HH:mm:ss.S z}:[%p]:[%t]:%c:%X{requestContext}:%m%n";

    private Log4JConfigurator() {}

    /**
     * Adds a console appender to the root logger unless some appender is
     * already configured.
     */
    public static void configure()
    {
        Logger rootLogger = Logger.getRootLogger();
        if(rootLogger.getAllAppenders().hasMoreElements())
            return;
        rootLogger.addAppender(new ConsoleAppender(new PatternLayout(LOGGING_LAYOUT)));
    }

    public static void setLogLevel(String level)
    {
        setLogLevel(Logger.getRootLogger(), level);
    }

    public static void setLogLevel(String name, String level)
    {
        if(name == null)
            return;
        setLogLevel(Logger.getLogger(name), level);
    }

    // Unknown level names are ignored rather than mapped to DEBUG:
    private static void setLogLevel(Logger logger, String level)
    {
        Level logLevel = Level.toLevel(level);
        if(logLevel.toString().equalsIgnoreCase(level))
            logger.setLevel(logLevel);
    }
}
