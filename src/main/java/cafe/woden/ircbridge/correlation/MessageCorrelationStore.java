package cafe.woden.ircbridge.correlation;

import cafe.woden.ircbridge.config.BridgeProperties;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-memory map between IRC message ids (source) and the Discord message ids (target) that were
 * created for them, or vice versa.
 *
 * <p>Both directions are insertion ordered. One IRC message can map to several Discord messages
 * (a media link is sent as two), and an id may be recorded more than once. Not persisted.
 */
@Component
public class MessageCorrelationStore {

  private final int maxEntries;
  private final Map<String, List<String>> bySource = new LinkedHashMap<>();
  private final Map<String, List<String>> byTarget = new LinkedHashMap<>();

  @Autowired
  public MessageCorrelationStore(BridgeProperties props) {
    this(props.correlation().maxEntries());
  }

  /** @param maxEntries maximum number of keys per direction; {@code 0} means unbounded */
  public MessageCorrelationStore(int maxEntries) {
    this.maxEntries = Math.max(0, maxEntries);
  }

  public synchronized void recordPair(String sourceId, String targetId) {
    String source = normalize(sourceId);
    String target = normalize(targetId);
    if (source.isEmpty() || target.isEmpty()) return;
    append(bySource, source, target);
    append(byTarget, target, source);
  }

  public synchronized List<String> lookupBySource(String sourceId) {
    return copy(bySource.get(normalize(sourceId)));
  }

  public synchronized List<String> lookupByTarget(String targetId) {
    return copy(byTarget.get(normalize(targetId)));
  }

  synchronized int sourceKeyCount() {
    return bySource.size();
  }

  synchronized int targetKeyCount() {
    return byTarget.size();
  }

  private void append(Map<String, List<String>> map, String key, String value) {
    map.computeIfAbsent(key, k -> new ArrayList<>(1)).add(value);
    if (maxEntries <= 0) return;
    Iterator<String> oldest = map.keySet().iterator();
    while (map.size() > maxEntries && oldest.hasNext()) {
      oldest.next();
      oldest.remove();
    }
  }

  private static List<String> copy(List<String> ids) {
    return ids == null ? List.of() : List.copyOf(ids);
  }

  private static String normalize(String id) {
    return Objects.toString(id, "").trim();
  }
}
