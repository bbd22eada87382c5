package com.drover.core.workspace;

import com.drover.core.model.WorkspaceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Mission-scoped, append-only store of findings that agents share with each other.
 * Once more than {@code maxMissions} missions have entries, the oldest mission is dropped.
 */
@Service
public class SharedWorkspace {

    private static final Logger log = LoggerFactory.getLogger(SharedWorkspace.class);

    static final String ENTRY_SEPARATOR = "\n\n---\n\n";

    private final int maxMissions;
    private final LinkedHashMap<String, List<WorkspaceEntry>> entriesByMission = new LinkedHashMap<>();

    @Autowired
    public SharedWorkspace(@Value("${drover.workspace.max-missions:100}") int maxMissions) {
        this.maxMissions = maxMissions;
    }

    public synchronized WorkspaceEntry add(String missionId, String agentId, String entryType, String title,
                                           String content, List<String> tags, List<String> references) {
        var entry = new WorkspaceEntry(UUID.randomUUID().toString().substring(0, 12), missionId, agentId,
                entryType, title, content, tags, references, Instant.now());
        entriesByMission.computeIfAbsent(missionId, k -> new ArrayList<>()).add(entry);
        evictOldest();
        log.debug("Workspace entry {} added by {} to mission {}", entry.id(), agentId, missionId);
        return entry;
    }

    /**
     * Entries of a mission, optionally narrowed to one agent and/or one entry type.
     */
    public synchronized List<WorkspaceEntry> query(String missionId, String agentId, String entryType) {
        return entriesByMission.getOrDefault(missionId, List.of()).stream()
                .filter(e -> agentId == null || agentId.equals(e.agentId()))
                .filter(e -> entryType == null || entryType.equals(e.entryType()))
                .toList();
    }

    /**
     * Renders every entry of a mission as markdown sections, oldest first.
     */
    public synchronized String missionSummary(String missionId) {
        return entriesByMission.getOrDefault(missionId, List.of()).stream()
                .map(SharedWorkspace::render)
                .collect(Collectors.joining(ENTRY_SEPARATOR));
    }

    private static String render(WorkspaceEntry entry) {
        String tags = entry.tags().isEmpty() ? "" : " [" + String.join(", ", entry.tags()) + "]";
        return "### [" + entry.agentId() + "] " + entry.title() + tags + "\n" + entry.content();
    }

    public synchronized void clearMission(String missionId) {
        entriesByMission.remove(missionId);
    }

    public synchronized List<String> missionIds() {
        return List.copyOf(entriesByMission.keySet());
    }

    private void evictOldest() {
        Iterator<String> it = entriesByMission.keySet().iterator();
        while (entriesByMission.size() > maxMissions && it.hasNext()) {
            String evicted = it.next();
            it.remove();
            log.debug("Evicted workspace entries of mission {}", evicted);
        }
    }
}
