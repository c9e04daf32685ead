package com.tinytasks.api.infra.tx;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of store work in exactly one transaction.
 * Any runtime exception thrown by the callback rolls the whole transaction back.
 */
@Component
public class TransactionalExecutor {

  private final TransactionTemplate tx;
  private final TransactionTemplate readOnlyTx;

  public TransactionalExecutor(PlatformTransactionManager txManager) {
    this.tx = new TransactionTemplate(txManager);
    this.readOnlyTx = new TransactionTemplate(txManager);
    this.readOnlyTx.setReadOnly(true);
  }

  public <T> T execute(Supplier<T> supplier) {
    return tx.execute(status -> supplier.get());
  }

  public <T> T query(Supplier<T> supplier) {
    return readOnlyTx.execute(status -> supplier.get());
  }

  public void run(Runnable runnable) {
    execute(() -> {
      runnable.run();
      return null;
    });
  }
}
