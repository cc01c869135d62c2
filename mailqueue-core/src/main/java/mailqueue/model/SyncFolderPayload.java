package mailqueue.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record SyncFolderPayload(long connectionId, long userId, String folderId, String folderName)
    implements JobPayload {

  public SyncFolderPayload {
    Objects.requireNonNull(folderId, "folderId");
  }

  @Override
  public JobType type() {
    return JobType.SYNC_FOLDER;
  }

  @Override
  public Long ownerUserId() {
    return userId;
  }

  @Override
  public Map<String, String> toFields() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("connectionId", Long.toString(connectionId));
    fields.put("userId", Long.toString(userId));
    fields.put("folderId", folderId);
    if (folderName != null) {
      fields.put("folderName", folderName);
    }
    return fields;
  }
}
