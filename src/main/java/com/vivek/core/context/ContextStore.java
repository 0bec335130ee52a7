package com.vivek.core.context;

import com.vivek.core.retrieval.TagNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flat, append-only store of session history.
 *
 * <p>Sessions, activities and tasks are kept in id-keyed maps and reference their parent by id.
 * Context items are appended in order and are never edited; only {@link #clear()} and
 * {@link #restore(ContextSnapshot)} remove them. Tags are normalized on the way in.
 *
 * <p>One store belongs to one run and has a single writer, so nothing here is synchronized.
 */
public class ContextStore {

    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);

    private final TagNormalizer tagNormalizer;
    private final Clock clock;

    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final Map<String, Activity> activities = new LinkedHashMap<>();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final List<ContextItem> items = new ArrayList<>();

    private ContextCursor cursor = ContextCursor.EMPTY;
    private long nextSequence;

    public ContextStore(TagNormalizer tagNormalizer, Clock clock) {
        this.tagNormalizer = tagNormalizer;
        this.clock = clock;
    }

    public ContextStore(TagNormalizer tagNormalizer) {
        this(tagNormalizer, Clock.systemUTC());
    }

    // ── Hierarchy ───────────────────────────────────────────────────

    /**
     * Creates a session and makes it current. A null or blank id is replaced by a generated one.
     */
    public Session createSession(String id, String originalRequest, String highLevelPlan) {
        String sessionId = resolveId(id, "session", sessions.keySet());
        requireAbsent(sessions.containsKey(sessionId), "session", sessionId);
        var session = new Session(sessionId, nullToEmpty(originalRequest), nullToEmpty(highLevelPlan),
                Instant.now(clock));
        sessions.put(sessionId, session);
        cursor = new ContextCursor(sessionId, null, null);
        log.debug("Created session {}", sessionId);
        return session;
    }

    /**
     * Creates an activity under an existing session and makes it current.
     */
    public Activity createActivity(String id, String sessionId, String description, Collection<String> tags,
                                   String mode, String component, String plannerRationale) {
        if (sessionId == null || !sessions.containsKey(sessionId)) {
            throw new StoreInvariantException("Activity parent session does not exist: " + sessionId);
        }
        String activityId = resolveId(id, "activity", activities.keySet());
        requireAbsent(activities.containsKey(activityId), "activity", activityId);
        var activity = new Activity(activityId, sessionId, nullToEmpty(description), normalizeAll(tags),
                mode, component, plannerRationale);
        activities.put(activityId, activity);
        cursor = new ContextCursor(sessionId, activityId, null);
        log.debug("Created activity {} in session {}", activityId, sessionId);
        return activity;
    }

    /**
     * Creates a task under an existing activity and makes it current.
     */
    public Task createTask(String id, String activityId, String description, Collection<String> tags) {
        Activity activity = activityId != null ? activities.get(activityId) : null;
        if (activity == null) {
            throw new StoreInvariantException("Task parent activity does not exist: " + activityId);
        }
        String taskId = resolveId(id, "task", tasks.keySet());
        requireAbsent(tasks.containsKey(taskId), "task", taskId);
        var task = new Task(taskId, activityId, nullToEmpty(description), normalizeAll(tags), null);
        tasks.put(taskId, task);
        cursor = new ContextCursor(activity.sessionId(), activityId, taskId);
        log.debug("Created task {} in activity {}", taskId, activityId);
        return task;
    }

    /**
     * Moves the cursor to an existing task, its activity and its session.
     */
    public ContextCursor focusTask(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new StoreInvariantException("Cannot focus unknown task: " + taskId);
        }
        Activity activity = activities.get(task.activityId());
        if (activity == null) {
            throw new StoreInvariantException("Task " + taskId + " references missing activity " + task.activityId());
        }
        cursor = new ContextCursor(activity.sessionId(), activity.id(), taskId);
        return cursor;
    }

    /**
     * Records the final result of a task.
     */
    public Task completeTask(String taskId, String result) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new StoreInvariantException("Cannot complete unknown task: " + taskId);
        }
        var completed = task.withResult(nullToEmpty(result));
        tasks.put(taskId, completed);
        return completed;
    }

    public Optional<Session> getSession(String id) {
        return Optional.ofNullable(id != null ? sessions.get(id) : null);
    }

    public Optional<Activity> getActivity(String id) {
        return Optional.ofNullable(id != null ? activities.get(id) : null);
    }

    public Optional<Task> getTask(String id) {
        return Optional.ofNullable(id != null ? tasks.get(id) : null);
    }

    public List<Activity> activitiesOf(String sessionId) {
        return activities.values().stream()
                .filter(a -> a.sessionId().equals(sessionId))
                .toList();
    }

    public List<Task> tasksOf(String activityId) {
        return tasks.values().stream()
                .filter(t -> t.activityId().equals(activityId))
                .toList();
    }

    // ── Cursor ──────────────────────────────────────────────────────

    public ContextCursor cursor() {
        return cursor;
    }

    public Optional<Session> getCurrentSession() {
        return resolveCursor(cursor.sessionId(), sessions, "session");
    }

    public Optional<Activity> getCurrentActivity() {
        return resolveCursor(cursor.activityId(), activities, "activity");
    }

    public Optional<Task> getCurrentTask() {
        return resolveCursor(cursor.taskId(), tasks, "task");
    }

    // ── Items ───────────────────────────────────────────────────────

    /**
     * Appends a fact. The parent, when given, must be an existing session, activity or task.
     */
    public ContextItem addItem(String content, ContextCategory category, Collection<String> tags, String parentId) {
        if (category == null) {
            throw new IllegalArgumentException("category must not be null");
        }
        if (parentId != null && !isKnownParent(parentId)) {
            throw new StoreInvariantException("Context item parent does not exist: " + parentId);
        }
        var item = new ContextItem(nextSequence++, nullToEmpty(content), category, normalizeAll(tags),
                parentId, Instant.now(clock));
        items.add(item);
        log.debug("Appended {} item #{} (parent={}, tags={})", category.label(), item.sequence(), parentId, item.tags());
        return item;
    }

    /**
     * Items sharing at least one normalized tag with {@code tags}, in append order.
     */
    public List<ContextItem> getItemsByTags(Collection<String> tags) {
        Set<String> query = new LinkedHashSet<>(normalizeAll(tags));
        if (query.isEmpty()) {
            return List.of();
        }
        return items.stream().filter(item -> item.sharesTag(query)).toList();
    }

    public List<ContextItem> getItemsByCategory(ContextCategory category) {
        return items.stream().filter(item -> item.category() == category).toList();
    }

    public List<ContextItem> getItemsForParent(String parentId) {
        return items.stream().filter(item -> parentId != null && parentId.equals(item.parentId())).toList();
    }

    public List<ContextItem> allItems() {
        return List.copyOf(items);
    }

    public TagNormalizer tagNormalizer() {
        return tagNormalizer;
    }

    public ContextStats stats() {
        var byCategory = new EnumMap<ContextCategory, Long>(ContextCategory.class);
        for (ContextItem item : items) {
            byCategory.merge(item.category(), 1L, Long::sum);
        }
        return new ContextStats(sessions.size(), activities.size(), tasks.size(), items.size(), byCategory);
    }

    public void clear() {
        sessions.clear();
        activities.clear();
        tasks.clear();
        items.clear();
        cursor = ContextCursor.EMPTY;
        nextSequence = 0;
    }

    // ── Checkpointing ───────────────────────────────────────────────

    public ContextSnapshot snapshot() {
        return new ContextSnapshot(
                List.copyOf(sessions.values()),
                List.copyOf(activities.values()),
                List.copyOf(tasks.values()),
                List.copyOf(items),
                cursor,
                nextSequence);
    }

    /**
     * Replaces the whole content of this store with a snapshot, validating every reference.
     * On failure the store is left empty.
     */
    public void restore(ContextSnapshot snapshot) {
        clear();
        if (snapshot == null) {
            return;
        }
        try {
            snapshot.sessions().forEach(s -> {
                requireAbsent(sessions.containsKey(s.id()), "session", s.id());
                sessions.put(s.id(), s);
            });
            snapshot.activities().forEach(a -> {
                if (!sessions.containsKey(a.sessionId())) {
                    throw new StoreInvariantException("Activity " + a.id() + " references missing session " + a.sessionId());
                }
                requireAbsent(activities.containsKey(a.id()), "activity", a.id());
                activities.put(a.id(), a);
            });
            snapshot.tasks().forEach(t -> {
                if (!activities.containsKey(t.activityId())) {
                    throw new StoreInvariantException("Task " + t.id() + " references missing activity " + t.activityId());
                }
                requireAbsent(tasks.containsKey(t.id()), "task", t.id());
                tasks.put(t.id(), t);
            });
            long maxSequence = -1;
            for (ContextItem item : snapshot.items()) {
                if (item.parentId() != null && !isKnownParent(item.parentId())) {
                    throw new StoreInvariantException("Context item #" + item.sequence()
                            + " references missing parent " + item.parentId());
                }
                items.add(item);
                maxSequence = Math.max(maxSequence, item.sequence());
            }
            cursor = snapshot.cursor();
            nextSequence = Math.max(snapshot.nextSequence(), maxSequence + 1);
            getCurrentSession();
            getCurrentActivity();
            getCurrentTask();
        } catch (StoreInvariantException e) {
            clear();
            throw e;
        }
        log.debug("Restored context: {}", stats());
    }

    // ── Internals ───────────────────────────────────────────────────

    private boolean isKnownParent(String id) {
        return sessions.containsKey(id) || activities.containsKey(id) || tasks.containsKey(id);
    }

    private <T> Optional<T> resolveCursor(String id, Map<String, T> records, String kind) {
        if (id == null) {
            return Optional.empty();
        }
        T record = records.get(id);
        if (record == null) {
            throw new StoreInvariantException("Cursor references missing " + kind + ": " + id);
        }
        return Optional.of(record);
    }

    private List<String> normalizeAll(Collection<String> tags) {
        return List.copyOf(tagNormalizer.normalizeAll(tags));
    }

    private static String resolveId(String requested, String prefix, Set<String> taken) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        int n = taken.size() + 1;
        while (taken.contains(prefix + "-" + n)) {
            n++;
        }
        return prefix + "-" + n;
    }

    private static void requireAbsent(boolean exists, String kind, String id) {
        if (exists) {
            throw new StoreInvariantException("Duplicate " + kind + " id: " + id);
        }
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
