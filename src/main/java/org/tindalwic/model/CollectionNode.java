package org.tindalwic.model;

/**
 * Common comment slots of the two array kinds: one comment introducing the contents and
 * one closing comment after the array.
 */
public abstract class CollectionNode extends Node {

    private Comment introComment;
    private Comment closingComment;

    CollectionNode() {
    }

    public abstract int size();

    public boolean isEmpty() {
        return size() == 0;
    }

    public Comment getIntroComment() {
        return introComment;
    }

    public void setIntroComment(Comment comment) {
        introComment = Comment.rebind(introComment, comment, this, CommentPosition.INTRODUCING_COLLECTION);
    }

    public Comment getClosingComment() {
        return closingComment;
    }

    public void setClosingComment(Comment comment) {
        closingComment = Comment.rebind(closingComment, comment, this, CommentPosition.CLOSING_COLLECTION);
    }

    void copyCommentsInto(CollectionNode copy) {
        copy.setLine(getLine());
        copy.setIntroComment(copyOf(introComment));
        copy.setClosingComment(copyOf(closingComment));
    }
}
