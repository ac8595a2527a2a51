package org.filesearcher.search;

/**
 * 进度接收方。
 * <p>
 * 由处理该文件的工作线程同步调用；引擎不做缓冲或去重，需要节流时由实现方自行处理。
 */
@FunctionalInterface
public interface SearchProgressListener {

    SearchProgressListener NONE = progress -> {
    };

    void onProgress(SearchProgress progress);
}
