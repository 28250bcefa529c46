package com.artifactduo.server.service.deploy;

import com.artifactduo.server.model.internal.CommandResult;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Authenticated connection to one deployment target. Remote paths always use "/" separators.
 */
public interface RemoteSession extends AutoCloseable {

    boolean exists(String remotePath) throws IOException;

    // 递归创建, 已存在时不报错
    void mkdirs(String remotePath) throws IOException;

    // 已存在的文件会被覆盖
    OutputStream openForWrite(String remotePath) throws IOException;

    CommandResult exec(String command) throws IOException;

    @Override
    void close();
}
