package alpha.nomagicdispatch.util;

import alpha.nomagicdispatch.message.Request;

import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * Objects associated with a holder.<p>
 * 
 * The request is the one holder in this library. Attributes are how a
 * {@link alpha.nomagicdispatch.handler.Handler Handler} and the code it
 * delegates to pass data along while the request is being handled:
 * 
 * <pre>{@code
 *   request.attributes().set("my.user", user);
 *   // Further down the call stack
 *   User u = request.attributes().getAny("my.user");
 * }</pre>
 * 
 * The implementation is thread-safe. Neither names nor values may be
 * {@code null}.<p>
 * 
 * The namespace "alpha.nomagicdispatch.*" is reserved for the library.
 * 
 * @see Request#attributes()
 */
public interface Attributes {
    /**
     * Returns the value of the named attribute.
     * 
     * @param name of attribute
     * 
     * @return the value (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Object get(String name);
    
    /**
     * Sets the value of the named attribute.
     * 
     * @param name  of attribute
     * @param value of attribute
     * 
     * @return the old value (may be {@code null})
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    Object set(String name, Object value);
    
    /**
     * Removes the named attribute.
     * 
     * @param name of attribute
     * 
     * @return the old value (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Object remove(String name);
    
    /**
     * Returns the value of the named attribute cast to V.<p>
     * 
     * The cast is implicit and the type is inferred by the compiler. The call
     * site still blows up with a {@code ClassCastException} if a non-null value
     * is not of the inferred type.
     * 
     * @param <V>  value type
     * @param name of attribute
     * 
     * @return the value (may be {@code null})
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    <V> V getAny(String name);
    
    /**
     * Returns the value of the named attribute, as an {@code Optional}.
     * 
     * @param name of attribute
     * 
     * @return the value (never {@code null} but possibly empty)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<Object> getOpt(String name);
    
    /**
     * Returns a modifiable map view of the attributes.<p>
     * 
     * Changes to the map are reflected in the attributes, and vice-versa.
     * 
     * @return a modifiable map view of the attributes
     */
    ConcurrentMap<String, Object> asMap();
}
