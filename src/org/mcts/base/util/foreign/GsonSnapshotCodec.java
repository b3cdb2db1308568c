package org.mcts.base.util.foreign;

import java.io.IOException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.IdentityHashMap;
import java.util.Map;

import org.apache.commons.lang3.reflect.FieldUtils;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

/**
 * Snapshot codec storing objects as JSON, via Gson.
 *
 * Snapshotted objects must form an acyclic graph.  Gson would silently drop a field referring to its own object, and
 * would overflow the stack on a longer cycle, so both are rejected with a {@link SnapshotException}.
 *
 * @param <T> the type of the foreign object.
 */
public class GsonSnapshotCodec<T> implements SnapshotCodec<T>
{
  private final Gson     mGson;
  private final Class<T> mClass;

  /**
   * Create a codec using Gson's default configuration.
   *
   * @param xiClass - the class of the objects to be snapshotted.
   */
  public GsonSnapshotCodec(Class<T> xiClass)
  {
    this(new Gson(), xiClass);
  }

  /**
   * Create a codec.
   *
   * @param xiGson - the Gson instance, which may have custom type adapters registered.
   * @param xiClass - the class of the objects to be snapshotted.
   */
  public GsonSnapshotCodec(Gson xiGson, Class<T> xiClass)
  {
    mGson = xiGson.newBuilder().registerTypeAdapterFactory(new AcyclicTypeAdapterFactory()).create();
    mClass = xiClass;
  }

  @Override
  public String toSnapshot(T xiObject)
  {
    if (xiObject == null)
    {
      throw new SnapshotException("Can't snapshot a null " + mClass.getSimpleName());
    }

    try
    {
      return mGson.toJson(xiObject, mClass);
    }
    catch (JsonParseException | UnsupportedOperationException | IllegalArgumentException lEx)
    {
      throw new SnapshotException("Failed to snapshot " + mClass.getSimpleName(), lEx);
    }
  }

  @Override
  public T fromSnapshot(String xiSnapshot)
  {
    T lResult;
    try
    {
      lResult = mGson.fromJson(xiSnapshot, mClass);
    }
    catch (JsonParseException | IllegalStateException | IllegalArgumentException lEx)
    {
      throw new SnapshotException("Failed to restore " + mClass.getSimpleName() + " from " + xiSnapshot, lEx);
    }

    if (lResult == null)
    {
      throw new SnapshotException("Snapshot '" + xiSnapshot + "' doesn't describe a " + mClass.getSimpleName());
    }
    return lResult;
  }

  /**
   * Wraps every adapter, tracking the objects currently being written on this thread.  Meeting one of them again
   * means the graph has a cycle.
   */
  private static class AcyclicTypeAdapterFactory implements TypeAdapterFactory
  {
    private final ThreadLocal<Map<Object, Boolean>> mInProgress = new ThreadLocal<Map<Object, Boolean>>()
    {
      @Override
      protected Map<Object, Boolean> initialValue()
      {
        return new IdentityHashMap<>();
      }
    };

    @Override
    public <X> TypeAdapter<X> create(Gson xiGson, TypeToken<X> xiType)
    {
      // Gson's Object adapter hands the same value straight on to the adapter for its runtime type.
      if (xiType.getRawType() == Object.class)
      {
        return null;
      }

      final TypeAdapter<X> lDelegate = xiGson.getDelegateAdapter(this, xiType);
      return new TypeAdapter<X>()
      {
        @Override
        public void write(JsonWriter xiOut, X xiValue) throws IOException
        {
          if (xiValue == null)
          {
            lDelegate.write(xiOut, xiValue);
            return;
          }

          Map<Object, Boolean> lInProgress = mInProgress.get();
          if (lInProgress.containsKey(xiValue))
          {
            throw new JsonIOException("Cycle through a " + xiValue.getClass().getName());
          }
          checkNoSelfReference(xiValue);

          lInProgress.put(xiValue, Boolean.TRUE);
          try
          {
            lDelegate.write(xiOut, xiValue);
          }
          finally
          {
            lInProgress.remove(xiValue);
          }
        }

        @Override
        public X read(JsonReader xiIn) throws IOException
        {
          return lDelegate.read(xiIn);
        }
      };
    }

    /**
     * Gson skips a field holding its own object without telling any adapter, so look for those directly.  JDK classes
     * aren't checked.
     */
    private static void checkNoSelfReference(Object xiValue)
    {
      Class<?> lClass = xiValue.getClass();
      if (lClass.isArray() || lClass.isEnum() || lClass.getName().startsWith("java"))
      {
        return;
      }

      for (Field lField : FieldUtils.getAllFieldsList(lClass))
      {
        int lModifiers = lField.getModifiers();
        if (Modifier.isStatic(lModifiers) || Modifier.isTransient(lModifiers) || lField.isSynthetic())
        {
          continue;
        }

        try
        {
          if (FieldUtils.readField(lField, xiValue, true) == xiValue)
          {
            throw new JsonIOException("Field " + lField.getName() + " of a " + lClass.getName() + " refers to itself");
          }
        }
        catch (IllegalAccessException lEx)
        {
          throw new JsonIOException("Can't read field " + lField.getName() + " of a " + lClass.getName(), lEx);
        }
      }
    }
  }
}
