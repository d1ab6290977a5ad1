/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.raciswarm.filesystem.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.raciswarm.core.archive.ArchivedConversation;
import com.phonepe.raciswarm.core.archive.ConversationArchive;
import com.phonepe.raciswarm.core.envelope.MessageEnvelope;
import com.phonepe.raciswarm.core.memory.MemorySnapshot;
import com.phonepe.raciswarm.core.utils.JsonUtils;
import com.phonepe.raciswarm.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;
import java.util.regex.Pattern;

/**
 * Disk based archive for closed conversations.
 * Implementation:
 * - Every conversation gets its own directory under the base directory
 * - conversation.json holds who, which swarm, how many turns and when it was closed
 * - snapshot.json holds the last memory snapshot
 * - envelopes.jsonl holds the envelope history, one JSON document per line, in sequence order
 * - late-envelopes.jsonl collects envelopes produced after the conversation was closed. Only ever appended to, so it
 * survives the conversation being archived after its first late envelope came in
 * - A single stamped lock guards all files
 */
@Slf4j
public class FileSystemConversationArchive implements ConversationArchive {
    static final String CONVERSATION_FILE_NAME = "conversation.json";
    static final String SNAPSHOT_FILE_NAME = "snapshot.json";
    static final String ENVELOPES_FILE_NAME = "envelopes.jsonl";
    static final String LATE_ENVELOPES_FILE_NAME = "late-envelopes.jsonl";

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path baseDir;
    private final ObjectMapper mapper;
    private final StampedLock lock = new StampedLock();

    @Builder
    public FileSystemConversationArchive(@NonNull Path baseDir, ObjectMapper mapper) {
        this.baseDir = FileUtils.ensurePath(baseDir, true);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        log.info("Archiving conversations under {}", this.baseDir);
    }

    @Override
    public boolean archive(ArchivedConversation conversation) {
        final var stamp = lock.writeLock();
        try {
            final var dir = FileUtils.ensurePath(conversationDir(conversation.getConversationId()), true);
            FileUtils.replace(dir.resolve(CONVERSATION_FILE_NAME),
                              mapper.writeValueAsBytes(conversation.withEnvelopes(List.of())
                                                               .withLateEnvelopes(List.of())
                                                               .withSnapshot(null)));
            if (null != conversation.getSnapshot()) {
                FileUtils.replace(dir.resolve(SNAPSHOT_FILE_NAME), mapper.writeValueAsBytes(conversation.getSnapshot()));
            }
            FileUtils.replace(dir.resolve(ENVELOPES_FILE_NAME), lines(conversation.getEnvelopes()));
            if (!conversation.getLateEnvelopes().isEmpty()) {
                FileUtils.append(dir.resolve(LATE_ENVELOPES_FILE_NAME), lines(conversation.getLateEnvelopes()));
            }
            log.debug("Archived conversation {} with {} envelopes to {}",
                      conversation.getConversationId(), conversation.getEnvelopes().size(), dir);
            return true;
        }
        catch (IOException e) {
            log.error("Could not archive conversation " + conversation.getConversationId(), e);
            return false;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public boolean appendLate(MessageEnvelope envelope) {
        final var stamp = lock.writeLock();
        try {
            final var dir = FileUtils.ensurePath(conversationDir(envelope.getConversationId()), true);
            FileUtils.append(dir.resolve(LATE_ENVELOPES_FILE_NAME), lines(List.of(envelope)));
            return true;
        }
        catch (IOException e) {
            log.error("Could not record late envelope {} for conversation {}: {}",
                      envelope.getSequenceNo(), envelope.getConversationId(), e.getMessage());
            return false;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Optional<ArchivedConversation> read(String conversationId) {
        final var stamp = lock.readLock();
        try {
            final var dir = conversationDir(conversationId);
            final var conversationFile = dir.resolve(CONVERSATION_FILE_NAME);
            if (!Files.exists(conversationFile)) {
                return Optional.empty();
            }
            final var conversation = mapper.readValue(conversationFile.toFile(), ArchivedConversation.class);
            final var snapshotFile = dir.resolve(SNAPSHOT_FILE_NAME);
            final var snapshot = Files.exists(snapshotFile)
                                 ? mapper.readValue(snapshotFile.toFile(), MemorySnapshot.class)
                                 : null;
            return Optional.of(conversation.withSnapshot(snapshot)
                                       .withEnvelopes(readLines(dir.resolve(ENVELOPES_FILE_NAME)))
                                       .withLateEnvelopes(readLines(dir.resolve(LATE_ENVELOPES_FILE_NAME))));
        }
        catch (IOException e) {
            throw new IllegalStateException("Could not read archived conversation " + conversationId, e);
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    /*
     * Conversation ids are made of user ids, which can contain anything. Those that are not safe file names get
     * encoded.
     */
    Path conversationDir(String conversationId) {
        final var name = SAFE_NAME.matcher(conversationId).matches() && !conversationId.startsWith(".")
                         ? conversationId
                         : "b64_" + Base64.getUrlEncoder()
                                 .withoutPadding()
                                 .encodeToString(conversationId.getBytes(StandardCharsets.UTF_8));
        return baseDir.resolve(name);
    }

    private byte[] lines(List<MessageEnvelope> envelopes) throws IOException {
        final var data = new ByteArrayOutputStream();
        for (final var envelope : envelopes) {
            data.write(mapper.writeValueAsBytes(envelope));
            data.write(System.lineSeparator().getBytes(StandardCharsets.UTF_8));
        }
        return data.toByteArray();
    }

    private List<MessageEnvelope> readLines(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        final var envelopes = new ArrayList<MessageEnvelope>();
        for (final var line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                envelopes.add(mapper.readValue(line, MessageEnvelope.class));
            }
        }
        return envelopes;
    }
}
