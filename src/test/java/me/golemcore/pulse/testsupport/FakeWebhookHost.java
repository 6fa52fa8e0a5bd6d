package me.golemcore.pulse.testsupport;

import me.golemcore.pulse.domain.exception.WebhookApiException;
import me.golemcore.pulse.domain.exception.WebhookConflictException;
import me.golemcore.pulse.domain.model.RemoteHook;
import me.golemcore.pulse.port.outbound.WebhookHostPort;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory repository host. Repositories can be told to answer a fixed HTTP
 * status instead of behaving normally.
 */
public class FakeWebhookHost implements WebhookHostPort {

    private final Map<String, List<RemoteHook>> hooks = new LinkedHashMap<>();
    private final Map<String, Integer> failures = new HashMap<>();
    private final Set<String> paths = new HashSet<>();
    private final AtomicInteger nextId = new AtomicInteger(1);
    private int createCalls;
    private int deleteCalls;
    private int listCalls;
    private boolean available = true;

    public void addRepository(String repository, String... existingHookUrls) {
        List<RemoteHook> list = new ArrayList<>();
        for (String url : existingHookUrls) {
            list.add(new RemoteHook(String.valueOf(nextId.getAndIncrement()), url, true));
        }
        hooks.put(repository, list);
    }

    public void failWith(String repository, int status) {
        failures.put(repository, status);
    }

    public void addPath(String repository, String path) {
        paths.add(repository + "/" + path);
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public List<String> hookUrls(String repository) {
        return hooks.getOrDefault(repository, List.of()).stream().map(RemoteHook::url).toList();
    }

    public int getCreateCalls() {
        return createCalls;
    }

    public int getDeleteCalls() {
        return deleteCalls;
    }

    public int getListCalls() {
        return listCalls;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public List<String> listResources() {
        return new ArrayList<>(hooks.keySet());
    }

    @Override
    public List<RemoteHook> listHooks(String resourceId) {
        listCalls++;
        checkFailure(resourceId, false);
        return new ArrayList<>(hooks.getOrDefault(resourceId, List.of()));
    }

    @Override
    public RemoteHook createHook(String resourceId, String callbackUrl) {
        createCalls++;
        checkFailure(resourceId, true);
        RemoteHook hook = new RemoteHook(String.valueOf(nextId.getAndIncrement()), callbackUrl, true);
        hooks.computeIfAbsent(resourceId, key -> new ArrayList<>()).add(hook);
        return hook;
    }

    @Override
    public void deleteHook(String resourceId, String hookId) {
        deleteCalls++;
        hooks.getOrDefault(resourceId, new ArrayList<>()).removeIf(hook -> hook.id().equals(hookId));
    }

    @Override
    public boolean pathExists(String resourceId, String path) {
        return paths.contains(resourceId + "/" + path);
    }

    private void checkFailure(String resourceId, boolean creating) {
        Integer status = failures.get(resourceId);
        if (status == null) {
            return;
        }
        if (status == WebhookConflictException.STATUS) {
            if (creating) {
                throw new WebhookConflictException("Hook already exists on this repository");
            }
            return;
        }
        throw new WebhookApiException(status, "GitHub API returned " + status);
    }
}
