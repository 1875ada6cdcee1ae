package io.lacuna.fst.ostia;

import io.lacuna.fst.Fst;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Optional;

/**
 * The outcome of a merge attempt: either the merged automaton, or the reason the merge was refused.
 *
 * @author ztellman
 */
public final class MergeResult {

  private final @Nullable Fst<String> fst;
  private final @Nullable String reason;

  private MergeResult(@Nullable Fst<String> fst, @Nullable String reason) {
    this.fst = fst;
    this.reason = reason;
  }

  public static MergeResult success(Fst<String> fst) {
    return new MergeResult(fst, null);
  }

  public static MergeResult failure(String reason) {
    return new MergeResult(null, reason);
  }

  public boolean isSuccess() {
    return fst != null;
  }

  /**
   * @return the merged automaton
   * @throws IllegalStateException if the merge failed
   */
  public Fst<String> fst() {
    if (fst == null) {
      throw new IllegalStateException("merge failed: " + reason);
    }
    return fst;
  }

  public Optional<String> reason() {
    return Optional.ofNullable(reason);
  }

  @Override
  public String toString() {
    return isSuccess() ? "merge succeeded" : "merge failed: " + reason;
  }
}
