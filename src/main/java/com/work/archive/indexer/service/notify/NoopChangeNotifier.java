package com.work.archive.indexer.service.notify;

public class NoopChangeNotifier implements ChangeNotifier {

    @Override
    public void publish(ChangeEvent event) {
    }
}
