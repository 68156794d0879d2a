package dev.mdtree.backend;

import java.util.List;

/**
 * Abstraction over whatever produces decision-tree text: a hosted language model,
 * a local model, or a replay of hand-authored transcripts.
 *
 * <p>No guarantee is made about the shape of the returned text; the parser tolerates anything.
 * Implementations used by the pipeline must be safe to call from several threads.
 */
public interface TreeTextGenerator {

    /**
     * Generate a response to a chat conversation.
     *
     * @param messages the conversation, oldest first
     * @return the response text, never null
     */
    String generate(List<Message> messages);

    /** Get generator display name. */
    String getName();
}
