package com.artifactduo.server.service.deploy;

import com.artifactduo.server.exception.DeploymentException;
import com.artifactduo.server.model.internal.CommandResult;
import com.artifactduo.server.model.internal.DeploymentTarget;
import com.artifactduo.server.service.config.PipelineConfigService;
import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * SSH/SFTP transport on top of JSch, password authentication.
 */
@Component
@Slf4j
public class JschRemoteSessionFactory implements RemoteSessionFactory {

    private static final long EXEC_POLL_INTERVAL_MILLIS = 50;

    private final PipelineConfigService pipelineConfigService;

    @Autowired
    public JschRemoteSessionFactory(PipelineConfigService pipelineConfigService) {
        this.pipelineConfigService = pipelineConfigService;
    }

    @Override
    public RemoteSession connect(DeploymentTarget target) throws DeploymentException {
        int connectTimeout = this.pipelineConfigService.getConnectTimeoutMillis();
        Session session = null;
        try {
            session = new JSch().getSession(target.user(), target.host(), target.port());
            session.setPassword(target.password());
            // 部署目标是内网机器, 不校验 host key
            session.setConfig("StrictHostKeyChecking", "no");
            session.connect(connectTimeout);
            ChannelSftp sftp = (ChannelSftp) session.openChannel("sftp");
            sftp.connect(connectTimeout);
            log.debug("connected to {}", target);
            return new JschRemoteSession(session, sftp, connectTimeout);
        } catch (JSchException e) {
            if (ObjectUtils.isNotEmpty(session)) {
                session.disconnect();
            }
            throw new DeploymentException("connect failed. target is %s:%s. %s"
                    .formatted(target.host(), target.port(), e.getMessage()), e);
        }
    }

    static class JschRemoteSession implements RemoteSession {

        private final Session session;

        private final ChannelSftp sftp;

        private final int connectTimeout;

        JschRemoteSession(Session session, ChannelSftp sftp, int connectTimeout) {
            this.session = session;
            this.sftp = sftp;
            this.connectTimeout = connectTimeout;
        }

        @Override
        public boolean exists(String remotePath) throws IOException {
            try {
                this.sftp.stat(remotePath);
                return true;
            } catch (SftpException e) {
                if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    return false;
                }
                throw new IOException("stat %s failed".formatted(remotePath), e);
            }
        }

        @Override
        public void mkdirs(String remotePath) throws IOException {
            StringBuilder current = new StringBuilder(remotePath.startsWith("/") ? "/" : "");
            for (String segment : StringUtils.split(remotePath, '/')) {
                current.append(segment);
                String folder = current.toString();
                if (!this.exists(folder)) {
                    try {
                        this.sftp.mkdir(folder);
                    } catch (SftpException e) {
                        throw new IOException("mkdir %s failed".formatted(folder), e);
                    }
                }
                current.append('/');
            }
        }

        @Override
        public OutputStream openForWrite(String remotePath) throws IOException {
            try {
                return this.sftp.put(remotePath, ChannelSftp.OVERWRITE);
            } catch (SftpException e) {
                throw new IOException("open %s for write failed".formatted(remotePath), e);
            }
        }

        @Override
        public CommandResult exec(String command) throws IOException {
            ChannelExec channel = null;
            try {
                channel = (ChannelExec) this.session.openChannel("exec");
                channel.setCommand(command);
                channel.setInputStream(null);
                ByteArrayOutputStream errorStream = new ByteArrayOutputStream();
                channel.setErrStream(errorStream);
                InputStream in = channel.getInputStream();
                channel.connect(this.connectTimeout);
                String output = IOUtils.toString(in, StandardCharsets.UTF_8);
                // 输出读完后等待 channel 关闭, 才能拿到 exit status
                while (!channel.isClosed()) {
                    Thread.sleep(EXEC_POLL_INTERVAL_MILLIS);
                }
                String error = errorStream.toString(StandardCharsets.UTF_8);
                String combined = StringUtils.isBlank(error) ? output : output + error;
                return CommandResult.of(command, channel.getExitStatus(), combined);
            } catch (JSchException e) {
                throw new IOException("exec '%s' failed".formatted(command), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("exec '%s' interrupted".formatted(command), e);
            } finally {
                if (ObjectUtils.isNotEmpty(channel)) {
                    channel.disconnect();
                }
            }
        }

        @Override
        public void close() {
            this.sftp.disconnect();
            this.session.disconnect();
        }
    }
}
