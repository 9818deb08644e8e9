package reducer.hir;

import java.util.List;

/** 
* Any class implementing this interface can act
* as a tree node by providing access to its children
* and parent.
*/
public interface Traversable extends Printable {

    /**
    * Provides access to the children of this object as a list. It is
    * generally not good practice to modify this list yourself; use the
    * methods of the particular class whose children you wish to change.
    *
    * @return the children as a list.
    */
    List<Traversable> getChildren();

    /**
    * Provides access to the parent of this object. Every IR object has at most
    * one parent.
    *
    * @return the parent of this object.
    */
    Traversable getParent();

    /**
    * Sets the <var>index</var><i>th</i> child of this object to <var>t</var>.
    * The old child located at the position <var>index</var> will have a null
    * parent.
    *
    * @throws NotAnOrphanException if <var>t</var> already has a parent.
    * @throws IllegalArgumentException if the type of the new child would
    *   violate a class invariant by becoming the <var>index</var><i>th</i>
    *   child.
    */
    void setChild(int index, Traversable t);

    /**
    * Sets the parent of this object. The intent is to maintain an ordering
    * where first this object becomes a child of another object, and then this
    * object is told who its parent is.
    */
    void setParent(Traversable t);

}
