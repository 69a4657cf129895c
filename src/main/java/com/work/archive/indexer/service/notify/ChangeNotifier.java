package com.work.archive.indexer.service.notify;

/**
 * 提交后变更通知。仅在事务提交后调用；实现必须 best-effort，不得向调用方抛出异常。
 */
public interface ChangeNotifier {

    void publish(ChangeEvent event);
}
