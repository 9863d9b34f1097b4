package com.gsesentinel.core.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns command records: assigns ids to admitted commands, closes them when the
 * equipment reports back and keeps a bounded log of rejections.
 *
 * <p>
 * Closed commands beyond the retention limit are forgotten oldest first.
 * Commands still waiting for an execution result are capped by the pending
 * limit; {@link #expireOverflow(Instant)} closes the oldest of them as FAILED
 * once the cap is exceeded.
 * </p>
 *
 * @since 1.0.0
 */
public class CommandLedger {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLedger.class);

    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, CommandRecord> commands = new ConcurrentHashMap<>();
    private final Deque<Long> closed = new ArrayDeque<>();
    private final LinkedHashSet<Long> pending = new LinkedHashSet<>();
    private final Deque<CommandRecord> rejections = new ArrayDeque<>();
    private final int retentionLimit;
    private final int pendingLimit;

    /**
     * @param retentionLimit how many closed commands and rejections to keep;
     *                       must be &ge; 0
     * @param pendingLimit   how many commands may wait for an execution
     *                       result; must be &ge; 1
     */
    public CommandLedger(int retentionLimit, int pendingLimit) {
        if (retentionLimit < 0) {
            throw new IllegalArgumentException("retentionLimit must be >= 0, got " + retentionLimit);
        }
        if (pendingLimit < 1) {
            throw new IllegalArgumentException("pendingLimit must be >= 1, got " + pendingLimit);
        }
        this.retentionLimit = retentionLimit;
        this.pendingLimit = pendingLimit;
    }

    /**
     * Record an admitted command under a fresh id.
     *
     * @return the ADMITTED record
     */
    public CommandRecord admit(String deviceId, CommandType type, CommandParameters parameters, String issuedBy,
            Instant at) {
        CommandRecord record = CommandRecord.builder()
                .id(nextId.getAndIncrement())
                .deviceId(deviceId)
                .commandType(type.getCode())
                .parameters(parameters)
                .issuedBy(issuedBy)
                .submittedAt(at)
                .status(CommandStatus.ADMITTED)
                .build();
        synchronized (pending) {
            commands.put(record.getId(), record);
            pending.add(record.getId());
        }
        return record;
    }

    /**
     * Close the oldest pending commands as FAILED while more than the pending
     * limit are waiting for an execution result.
     *
     * @param at completion time recorded on the expired commands
     * @return the expired records, oldest first; empty if within the limit
     */
    public List<CommandRecord> expireOverflow(Instant at) {
        List<Long> overflow = new ArrayList<>();
        synchronized (pending) {
            Iterator<Long> oldest = pending.iterator();
            for (int excess = pending.size() - pendingLimit; excess > 0 && oldest.hasNext(); excess--) {
                overflow.add(oldest.next());
            }
        }
        List<CommandRecord> expired = new ArrayList<>(overflow.size());
        for (Long id : overflow) {
            try {
                expired.add(complete(id, false,
                        "No execution result reported; pending limit of " + pendingLimit + " exceeded", at));
            } catch (IllegalStateException | CommandNotFoundException e) {
                LOG.debug("Command {} closed concurrently before expiry: {}", id, e.getMessage());
            }
        }
        if (!expired.isEmpty()) {
            LOG.warn("Expired {} pending command(s) without an execution result", expired.size());
        }
        return expired;
    }

    /**
     * Record a rejected submission. Rejections get no id.
     *
     * @return the REJECTED record
     */
    public CommandRecord reject(String deviceId, String commandType, String issuedBy, RejectionReason reason,
            String detail, Instant at) {
        CommandRecord record = CommandRecord.builder()
                .deviceId(deviceId == null ? "" : deviceId)
                .commandType(commandType == null ? "" : commandType)
                .issuedBy(issuedBy)
                .submittedAt(at)
                .status(CommandStatus.REJECTED)
                .rejectionReason(reason)
                .detail(detail)
                .completedAt(at)
                .build();
        synchronized (rejections) {
            rejections.addLast(record);
            while (rejections.size() > retentionLimit) {
                rejections.removeFirst();
            }
        }
        return record;
    }

    /**
     * Close an admitted command.
     *
     * @param commandId ledger id
     * @param success   whether the equipment executed it
     * @param detail    optional execution detail
     * @param at        completion time
     * @return the EXECUTED or FAILED record
     * @throws CommandNotFoundException if the id is unknown
     * @throws IllegalStateException    if the command is already closed
     */
    public CommandRecord complete(long commandId, boolean success, String detail, Instant at) {
        CommandRecord[] result = new CommandRecord[1];
        CommandRecord updated = commands.computeIfPresent(commandId, (id, current) -> {
            if (current.getStatus() != CommandStatus.ADMITTED) {
                throw new IllegalStateException(
                        "Command " + commandId + " is already closed with status " + current.getStatus());
            }
            Instant completedAt = at.isBefore(current.getSubmittedAt()) ? current.getSubmittedAt() : at;
            result[0] = current.toBuilder()
                    .status(success ? CommandStatus.EXECUTED : CommandStatus.FAILED)
                    .detail(detail)
                    .completedAt(completedAt)
                    .build();
            return result[0];
        });
        if (updated == null) {
            throw new CommandNotFoundException(commandId);
        }
        synchronized (pending) {
            pending.remove(commandId);
        }
        retainClosed(commandId);
        LOG.info("Command {} ({}) on {} {}", commandId, updated.getCommandType(), updated.getDeviceId(),
                updated.getStatus());
        return result[0];
    }

    /**
     * @param commandId ledger id
     * @return the record, or empty if unknown or evicted
     */
    public Optional<CommandRecord> find(long commandId) {
        return Optional.ofNullable(commands.get(commandId));
    }

    /**
     * @param deviceId device identifier
     * @return commands on the device still waiting for an execution result,
     *         oldest first
     */
    public List<CommandRecord> pendingCommands(String deviceId) {
        List<CommandRecord> result = new ArrayList<>();
        synchronized (pending) {
            for (Long id : pending) {
                CommandRecord record = commands.get(id);
                if (record != null && record.getDeviceId().equals(deviceId)) {
                    result.add(record);
                }
            }
        }
        result.sort(Comparator.comparing(CommandRecord::getSubmittedAt).thenComparingLong(CommandRecord::getId));
        return List.copyOf(result);
    }

    /**
     * @return retained rejections, oldest first
     */
    public List<CommandRecord> recentRejections() {
        synchronized (rejections) {
            return List.copyOf(new ArrayList<>(rejections));
        }
    }

    private void retainClosed(long commandId) {
        synchronized (closed) {
            closed.addLast(commandId);
            while (closed.size() > retentionLimit) {
                commands.remove(closed.removeFirst());
            }
        }
    }

    @Override
    public String toString() {
        return "CommandLedger{commands=" + commands.size() + ", retentionLimit=" + retentionLimit
                + ", pendingLimit=" + pendingLimit + '}';
    }
}
