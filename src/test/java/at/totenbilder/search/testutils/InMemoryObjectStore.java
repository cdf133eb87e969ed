package at.totenbilder.search.testutils;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.store.ImageObjectStore;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

public class InMemoryObjectStore implements ImageObjectStore {

    private final Map<String, byte[]> objects = new TreeMap<>();
    private final Set<String> brokenKeys = new HashSet<>();
    private boolean available = true;

    public InMemoryObjectStore put(String key, byte[] content) {
        objects.put(key, content);
        return this;
    }

    /**
     * Listed, but every fetch fails with a store error
     */
    public InMemoryObjectStore putBroken(String key) {
        objects.put(key, new byte[0]);
        brokenKeys.add(key);
        return this;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public Iterable<String> listKeys(String prefix) {
        List<String> keys = objects.keySet().stream()
            .filter(key -> key.startsWith(prefix))
            .collect(Collectors.toList());
        return keys;
    }

    @Override
    public byte[] fetch(String key) {
        if (brokenKeys.contains(key)) {
            throw new ServiceException("connection reset", SearchErrorCode.OBJECT_STORE_ERROR);
        }
        byte[] content = objects.get(key);
        if (content == null) {
            throw new ClientException("no such key " + key, SearchErrorCode.IMAGE_NOT_FOUND);
        }
        return content;
    }
}
