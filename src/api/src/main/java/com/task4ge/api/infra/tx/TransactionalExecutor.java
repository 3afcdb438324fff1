package com.task4ge.api.infra.tx;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

@Component
public class TransactionalExecutor {

  private final TransactionTemplate tx;

  public TransactionalExecutor(PlatformTransactionManager txManager) {
    this.tx = new TransactionTemplate(txManager);
  }

  public <T> T execute(Supplier<T> supplier) {
    return tx.execute(status -> supplier.get());
  }

  public void run(Runnable runnable) {
    execute(() -> {
      runnable.run();
      return null;
    });
  }

  public UnitOfWork begin() {
    return new UnitOfWork(this);
  }
}
