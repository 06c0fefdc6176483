package npcsim.memory;

public class UnknownEntityException extends IllegalArgumentException {
  private final String entityId;

  public UnknownEntityException(String entityId) {
    super("Unknown entity: " + entityId);
    this.entityId = entityId;
  }

  public String entityId() {
    return entityId;
  }
}
