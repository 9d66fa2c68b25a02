package dk.cloudcreate.streamstore.aggregates;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when an event is raised on, or restored into, an
 * {@link EventSourcedAggregate} that was created using the {@link EventSourcedAggregate#EventSourcedAggregate()} constructor.<br>
 * The method must take exactly one parameter: the event type it handles.
 *
 * @see EventRoutes#annotated(Class)
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
