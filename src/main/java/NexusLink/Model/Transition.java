package NexusLink.Model;

public record Transition(String symbol, int target) {

  @Override
  public String toString() {
    return symbol + " -> " + target;
  }
}
