package com.gsesentinel.app;

import com.gsesentinel.core.command.CommandDispatcher;
import com.gsesentinel.core.command.CommandRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link CommandDispatcher} for replay runs: there is no equipment link, so
 * admitted commands are logged and counted. Outcomes arrive later as
 * {@code command_result} lines in the replay input.
 */
public class LoggingCommandDispatcher implements CommandDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingCommandDispatcher.class);

    private final AtomicLong dispatched = new AtomicLong();

    @Override
    public void dispatch(CommandRecord command) {
        dispatched.incrementAndGet();
        LOG.info("Dispatching command {} {} {} to {} (issued by {})", command.getId(), command.getCommandType(),
                command.getParameters(), command.getDeviceId(), command.getIssuedBy());
    }

    /**
     * @return number of commands dispatched so far
     */
    public long getDispatchedCount() {
        return dispatched.get();
    }
}
