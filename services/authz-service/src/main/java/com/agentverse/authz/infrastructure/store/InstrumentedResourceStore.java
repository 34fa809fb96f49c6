package com.agentverse.authz.infrastructure.store;

import com.agentverse.authz.domain.error.AuthzException;
import com.agentverse.authz.domain.error.UnavailableException;
import com.agentverse.authz.domain.model.Agent;
import com.agentverse.authz.domain.model.Group;
import com.agentverse.authz.domain.model.GroupAgent;
import com.agentverse.authz.domain.model.Membership;
import com.agentverse.authz.domain.model.User;
import com.agentverse.authz.domain.store.ResourceStore;
import com.agentverse.observability.CorrelationContext;
import com.agentverse.observability.CorrelationContextHolder;
import com.agentverse.observability.SpanHelper;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a {@link ResourceStore} with a per-call timeout and a tracing span.
 *
 * <p>Calls run on the given executor with the caller's correlation and OpenTelemetry context.
 * A read that exceeds the timeout or is interrupted surfaces as {@link UnavailableException}.
 * A write that exceeds the timeout is logged and awaited; its eventual outcome is returned.
 * Any failure other than an {@link AuthzException} surfaces as {@link UnavailableException};
 * {@code NotFound} and {@code Conflict} pass through unchanged.
 */
public class InstrumentedResourceStore implements ResourceStore {

    private static final Logger log = LoggerFactory.getLogger(InstrumentedResourceStore.class);

    private final ResourceStore delegate;
    private final ExecutorService executor;
    private final Duration timeout;
    private final SpanHelper spans;

    public InstrumentedResourceStore(
            ResourceStore delegate, ExecutorService executor, Duration timeout, SpanHelper spans) {
        this.delegate = delegate;
        this.executor = executor;
        this.timeout = timeout;
        this.spans = spans;
    }

    @Override
    public Optional<Group> findGroup(String groupId) {
        return call("findGroup", () -> delegate.findGroup(groupId));
    }

    @Override
    public List<Group> listGroups() {
        return call("listGroups", delegate::listGroups);
    }

    @Override
    public List<Group> getGroups(Collection<String> groupIds) {
        return call("getGroups", () -> delegate.getGroups(groupIds));
    }

    @Override
    public Group insertGroup(Group group) {
        return write("insertGroup", () -> delegate.insertGroup(group));
    }

    @Override
    public Group updateGroup(Group group) {
        return write("updateGroup", () -> delegate.updateGroup(group));
    }

    @Override
    public void deleteGroup(String groupId) {
        runWrite("deleteGroup", () -> delegate.deleteGroup(groupId));
    }

    @Override
    public Optional<Membership> getMembership(String subjectId, String groupId) {
        return call("getMembership", () -> delegate.getMembership(subjectId, groupId));
    }

    @Override
    public List<Membership> listMemberships(String groupId) {
        return call("listMemberships", () -> delegate.listMemberships(groupId));
    }

    @Override
    public List<Membership> listMembershipsForSubject(String subjectId) {
        return call("listMembershipsForSubject", () -> delegate.listMembershipsForSubject(subjectId));
    }

    @Override
    public int countAdmins(String groupId) {
        return call("countAdmins", () -> delegate.countAdmins(groupId));
    }

    @Override
    public Map<String, Integer> countMembersByGroup() {
        return call("countMembersByGroup", delegate::countMembersByGroup);
    }

    @Override
    public Membership insertMembership(Membership membership) {
        return write("insertMembership", () -> delegate.insertMembership(membership));
    }

    @Override
    public Membership upsertMembership(Membership membership) {
        return write("upsertMembership", () -> delegate.upsertMembership(membership));
    }

    @Override
    public void deleteMembership(String subjectId, String groupId) {
        runWrite("deleteMembership", () -> delegate.deleteMembership(subjectId, groupId));
    }

    @Override
    public Optional<Agent> findAgent(String agentId) {
        return call("findAgent", () -> delegate.findAgent(agentId));
    }

    @Override
    public Optional<Agent> findAgentByExternalId(String externalId) {
        return call("findAgentByExternalId", () -> delegate.findAgentByExternalId(externalId));
    }

    @Override
    public List<Agent> listAgents() {
        return call("listAgents", delegate::listAgents);
    }

    @Override
    public List<Agent> getAgents(Collection<String> agentIds) {
        return call("getAgents", () -> delegate.getAgents(agentIds));
    }

    @Override
    public Agent insertAgent(Agent agent) {
        return write("insertAgent", () -> delegate.insertAgent(agent));
    }

    @Override
    public void deleteAgent(String agentId) {
        runWrite("deleteAgent", () -> delegate.deleteAgent(agentId));
    }

    @Override
    public Optional<GroupAgent> findGroupAgent(String groupId, String agentId) {
        return call("findGroupAgent", () -> delegate.findGroupAgent(groupId, agentId));
    }

    @Override
    public List<GroupAgent> listGroupAgents(String groupId) {
        return call("listGroupAgents", () -> delegate.listGroupAgents(groupId));
    }

    @Override
    public List<GroupAgent> listGroupsForAgent(String agentId) {
        return call("listGroupsForAgent", () -> delegate.listGroupsForAgent(agentId));
    }

    @Override
    public List<GroupAgent> listAllGroupAgents() {
        return call("listAllGroupAgents", delegate::listAllGroupAgents);
    }

    @Override
    public GroupAgent insertGroupAgent(GroupAgent link) {
        return write("insertGroupAgent", () -> delegate.insertGroupAgent(link));
    }

    @Override
    public GroupAgent upsertGroupAgent(GroupAgent link) {
        return write("upsertGroupAgent", () -> delegate.upsertGroupAgent(link));
    }

    @Override
    public void deleteGroupAgent(String groupId, String agentId) {
        runWrite("deleteGroupAgent", () -> delegate.deleteGroupAgent(groupId, agentId));
    }

    @Override
    public List<GroupAgent> deleteGroupAgentsForAgent(String agentId) {
        return write("deleteGroupAgentsForAgent", () -> delegate.deleteGroupAgentsForAgent(agentId));
    }

    @Override
    public Optional<User> findUser(String userId) {
        return call("findUser", () -> delegate.findUser(userId));
    }

    @Override
    public List<User> getUsers(Collection<String> userIds) {
        return call("getUsers", () -> delegate.getUsers(userIds));
    }

    @Override
    public User upsertUser(User user) {
        return write("upsertUser", () -> delegate.upsertUser(user));
    }

    private void runWrite(String operation, Runnable work) {
        write(operation, () -> {
            work.run();
            return null;
        });
    }

    private <T> T call(String operation, Supplier<T> work) {
        Future<T> future = submit(operation, work);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Store call {} timed out after {} ms", operation, timeout.toMillis());
            throw new UnavailableException("Store call " + operation + " timed out", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UnavailableException("Interrupted during store call " + operation, e);
        } catch (ExecutionException e) {
            throw unwrap(operation, e);
        }
    }

    /**
     * Writes are never abandoned: a write still running at the timeout is awaited until it
     * commits or fails, so the caller's group lock stays held and its outcome is the real one.
     */
    private <T> T write(String operation, Supplier<T> work) {
        Future<T> future = submit(operation, work);
        long started = System.nanoTime();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Store write {} still running after {} ms, waiting for it to settle",
                    operation, timeout.toMillis());
            return settle(operation, future, started, false);
        } catch (InterruptedException e) {
            return settle(operation, future, started, true);
        } catch (ExecutionException e) {
            throw unwrap(operation, e);
        }
    }

    private <T> T settle(String operation, Future<T> future, long started, boolean interrupted) {
        try {
            while (true) {
                try {
                    T result = future.get();
                    log.warn("Store write {} settled after {} ms", operation,
                            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
                    return result;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    throw unwrap(operation, e);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private <T> Future<T> submit(String operation, Supplier<T> work) {
        Optional<CorrelationContext> correlation = CorrelationContextHolder.get();
        Callable<T> task = Context.current().wrap(() -> {
            AtomicReference<T> result = new AtomicReference<>();
            Runnable traced = () -> result.set(spans.inSpan("store." + operation, SpanKind.CLIENT,
                    Map.of("store.operation", operation), work));
            if (correlation.isPresent()) {
                CorrelationContextHolder.runWithContext(correlation.get(), traced);
            } else {
                traced.run();
            }
            return result.get();
        });
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new UnavailableException("Store executor rejected " + operation, e);
        }
    }

    private static RuntimeException unwrap(String operation, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof AuthzException authz) {
            return authz;
        }
        log.error("Store call {} failed", operation, cause);
        return new UnavailableException("Store call " + operation + " failed", cause);
    }
}
