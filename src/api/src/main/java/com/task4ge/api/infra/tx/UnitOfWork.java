package com.task4ge.api.infra.tx;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes collected during one request and committed together in a single transaction.
 *
 * <p>Nothing reaches the database until {@link #commit()}; a unit can be committed once.
 */
public final class UnitOfWork {

  private final TransactionalExecutor tx;
  private final List<Runnable> pending = new ArrayList<>();
  private boolean committed;

  UnitOfWork(TransactionalExecutor tx) {
    this.tx = tx;
  }

  public void add(Runnable write) {
    if (committed) {
      throw new IllegalStateException("Unit of work already committed");
    }
    pending.add(write);
  }

  public int pendingCount() {
    return pending.size();
  }

  public void commit() {
    if (committed) {
      throw new IllegalStateException("Unit of work already committed");
    }
    tx.run(() -> pending.forEach(Runnable::run));
    committed = true;
  }
}
